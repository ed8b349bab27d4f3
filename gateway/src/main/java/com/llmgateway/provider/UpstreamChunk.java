package com.llmgateway.provider;

/**
 * One decoded unit of provider output, independent of wire format.
 */
public record UpstreamChunk(Kind kind, String text) {

    public enum Kind {
        TEXT,
        END,
        FAILURE
    }

    private static final UpstreamChunk END_OF_STREAM = new UpstreamChunk(Kind.END, null);

    public static UpstreamChunk text(String text) {
        return new UpstreamChunk(Kind.TEXT, text);
    }

    public static UpstreamChunk end() {
        return END_OF_STREAM;
    }

    /**
     * @param upstreamMessage raw provider text, classified before anyone sees it
     */
    public static UpstreamChunk failure(String upstreamMessage) {
        return new UpstreamChunk(Kind.FAILURE, upstreamMessage);
    }
}
