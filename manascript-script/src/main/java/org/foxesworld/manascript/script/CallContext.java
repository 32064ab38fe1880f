package org.foxesworld.manascript.script;

/**
 * In-progress state of one prepare/push/execute cycle.
 * {@code argumentCount == -1} means no call is prepared.
 */
final class CallContext {

    static final int NO_CALL = -1;

    private int argumentCount = NO_CALL;
    private String functionName;
    private boolean failed;

    boolean inProgress() {
        return argumentCount >= 0;
    }

    int argumentCount() {
        return argumentCount;
    }

    String functionName() {
        return functionName;
    }

    /** True once the backend failed while preparing; the call then ends with a failed result. */
    boolean failed() {
        return failed;
    }

    void begin(String name) {
        functionName = name;
        argumentCount = 0;
        failed = false;
    }

    void fail() {
        failed = true;
    }

    void argumentPushed() {
        argumentCount++;
    }

    void reset() {
        argumentCount = NO_CALL;
        functionName = null;
        failed = false;
    }
}
