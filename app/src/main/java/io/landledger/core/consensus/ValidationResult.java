package io.landledger.core.consensus;

public final class ValidationResult {
    private static final ValidationResult OK = new ValidationResult(true, null, -1L, null);

    public final boolean ok;
    public final ChainError error;
    /** Block index the error was found at, -1 when not tied to one block. */
    public final long blockIndex;
    public final String message;

    private ValidationResult(boolean ok, ChainError error, long blockIndex, String message) {
        this.ok = ok; this.error = error; this.blockIndex = blockIndex; this.message = message;
    }
    public static ValidationResult ok() { return OK; }
    public static ValidationResult error(ChainError e, long blockIndex, String msg) {
        return new ValidationResult(false, e, blockIndex, msg);
    }

    @Override public String toString() {
        return ok ? "OK" : ("ERR["+error+"@"+blockIndex+"]: "+message);
    }
}
