package tech.ydb.trace.pipeline;

import javax.annotation.Nullable;

/**
 * Statement passed through the execution pipeline.
 */
public class PipelineQuery {
    @Nullable
    private final String text;

    public PipelineQuery(@Nullable String text) {
        this.text = text;
    }

    /**
     * @return source text of the statement, {@code null} for statements built without text
     */
    @Nullable
    public String getText() {
        return text;
    }

    @Override
    public String toString() {
        return "PipelineQuery[" + text + "]";
    }
}
