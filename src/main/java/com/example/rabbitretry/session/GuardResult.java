package com.example.rabbitretry.session;

/**
 * 受保护操作的执行结果
 */
public enum GuardResult {
    /** 已执行 */
    OK,

    /** 会话不可用，未执行 */
    SKIPPED,

    /** 会话可用，但操作本身抛出了异常 */
    FAILED;

    public boolean isOk() {
        return this == OK;
    }
}
