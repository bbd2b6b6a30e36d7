package edu.umich.andykong.shiftlocalizer.core;

/**
 * A PSM that cannot be localized. These are input validation failures, retrying will not help.
 */
public class LocalizationException extends Exception {
    private final String recordId;

    public LocalizationException(String message, String recordId) {
        super(message);
        this.recordId = recordId;
    }

    public LocalizationException(String message, String recordId, Throwable cause) {
        super(message, cause);
        this.recordId = recordId;
    }

    /**
     * @return identifier of the failed PSM, null when raised outside of a PSM context
     */
    public String getRecordId() {
        return recordId;
    }

    @Override
    public String getMessage() {
        if (recordId == null)
            return super.getMessage();
        return String.format("[%s] %s", recordId, super.getMessage());
    }
}
