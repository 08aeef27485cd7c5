package de.alive.otpfetch.exception;

public class OtpParseException extends Exception {

    private final String folder;
    private final long uid;
    private final ParseStage stage;

    public enum ParseStage {
        CONTENT_EXTRACTION,
        TOKEN_EXTRACTION
    }

    public OtpParseException(String message, String folder, long uid, ParseStage stage) {
        super(message);
        this.folder = folder;
        this.uid = uid;
        this.stage = stage;
    }

    public OtpParseException(String message, String folder, long uid, ParseStage stage, Throwable cause) {
        super(message, cause);
        this.folder = folder;
        this.uid = uid;
        this.stage = stage;
    }

    public String getFolder() {
        return folder;
    }

    public long getUid() {
        return uid;
    }

    public ParseStage getStage() {
        return stage;
    }
}
