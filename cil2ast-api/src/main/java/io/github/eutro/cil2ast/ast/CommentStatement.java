package io.github.eutro.cil2ast.ast;

/**
 * A line comment. Used for stubs in place of code that could not be reconstructed.
 */
public final class CommentStatement extends Statement {
    private final String text;

    public CommentStatement(String text) {
        this.text = text;
    }

    public String getText() {
        return text;
    }

    @Override
    public Kind getKind() {
        return Kind.COMMENT;
    }
}
