package model;

import com.github.javaparser.Range;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.SwitchExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.SwitchStmt;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Walks one top-level statement of a body and records the depth reached at every
 * block-delimited node.
 * <p>
 * There is no ancestor stack: whether a block is nested in the previously seen one or
 * follows it is decided only by comparing the two spans. A block that starts after the
 * previous one and also ends after it closes the previous level first, so sibling
 * branches and consecutive loops do not add up.
 * <p>
 * Children are visited in source order. The generated {@code VoidVisitorAdapter} visits
 * properties alphabetically (else before then, catch clauses before the try block), which
 * would break the span comparison.
 */
public class MaxDepthVisitor {

    private static final Comparator<Node> BY_BEGIN = Comparator.comparing(n -> n.getBegin().orElseThrow());

    private int currentDepth = 0;
    private LexicalSpan lastSpan;
    private final List<Integer> nodeDepths = new ArrayList<>();

    public void visit(Node node) {
        if (isBlockDelimited(node)) {
            node.getRange().ifPresent(this::enterBlock);
        }

        List<Node> children = new ArrayList<>();
        for (Node child : node.getChildNodes()) {
            if (child.getRange().isPresent()) {
                children.add(child);
            }
        }
        children.sort(BY_BEGIN);
        for (Node child : children) {
            visit(child);
        }
    }

    private void enterBlock(Range range) {
        LexicalSpan span = LexicalSpan.of(range);
        if (lastSpan != null && span.isPastEndOf(lastSpan)) {
            currentDepth--;
        }
        lastSpan = span;
        currentDepth++;
        nodeDepths.add(currentDepth);
    }

    private static boolean isBlockDelimited(Node node) {
        return node instanceof BlockStmt || node instanceof SwitchStmt || node instanceof SwitchExpr;
    }

    public int getMaxDepth() {
        int max = 0;
        for (int depth : nodeDepths) {
            if (depth > max) {
                max = depth;
            }
        }
        return max;
    }

    public List<Integer> getNodeDepths() {
        return List.copyOf(nodeDepths);
    }
}
