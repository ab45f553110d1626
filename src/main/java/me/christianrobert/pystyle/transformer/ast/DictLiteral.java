package me.christianrobert.pystyle.transformer.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Dictionary literal; {@code keys.get(i)} maps to {@code values.get(i)}.
 */
public class DictLiteral extends SyntaxNode {

    private final List<SyntaxNode> keys;
    private final List<SyntaxNode> values;

    public DictLiteral(List<SyntaxNode> keys, List<SyntaxNode> values, SourceSpan span) {
        super(NodeKind.DICT_LITERAL, span);
        this.keys = immutableCopy(keys);
        this.values = immutableCopy(values);
    }

    public List<SyntaxNode> getKeys() {
        return keys;
    }

    public List<SyntaxNode> getValues() {
        return values;
    }

    public boolean isEmpty() {
        return keys.isEmpty();
    }

    @Override
    public <R> R accept(SyntaxVisitor<R> visitor) {
        return visitor.visitDictLiteral(this);
    }

    @Override
    public List<SyntaxNode> getChildren() {
        // key/value interleaved, source order
        List<SyntaxNode> result = new ArrayList<>();
        int size = Math.max(keys.size(), values.size());
        for (int i = 0; i < size; i++) {
            if (i < keys.size()) {
                result.add(keys.get(i));
            }
            if (i < values.size()) {
                result.add(values.get(i));
            }
        }
        return Collections.unmodifiableList(result);
    }
}
