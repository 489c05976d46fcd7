package controller;

import com.github.javaparser.ast.body.CompactConstructorDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.Statement;
import model.MaxDepthVisitor;

import java.util.Optional;

// Maximum nesting depth of a declaration body
public class DepthCalculator {

    private DepthCalculator() {}

    public static Optional<BlockStmt> getBody(BodyDeclaration<?> declaration) {
        if (declaration instanceof MethodDeclaration) {
            return ((MethodDeclaration) declaration).getBody();
        }
        if (declaration instanceof ConstructorDeclaration) {
            return Optional.of(((ConstructorDeclaration) declaration).getBody());
        }
        if (declaration instanceof CompactConstructorDeclaration) {
            return Optional.of(((CompactConstructorDeclaration) declaration).getBody());
        }
        return Optional.empty();
    }

    public static int calculateDepth(BodyDeclaration<?> declaration) {
        return getBody(declaration).map(DepthCalculator::calculateDepth).orElse(0);
    }

    // Each top-level statement gets its own walk; the body braces are not a level
    public static int calculateDepth(BlockStmt body) {
        int max = 0;
        for (Statement statement : body.getStatements()) {
            max = Math.max(max, calculateStatementDepth(statement));
        }
        return max;
    }

    public static int calculateStatementDepth(Statement statement) {
        MaxDepthVisitor visitor = new MaxDepthVisitor();
        visitor.visit(statement);
        return visitor.getMaxDepth();
    }
}
