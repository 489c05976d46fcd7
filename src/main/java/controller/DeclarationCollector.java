package controller;

import com.github.javaparser.Position;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.CompactConstructorDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.EnumConstantDeclaration;
import com.github.javaparser.ast.body.EnumDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.stmt.BlockStmt;
import model.Stat;

import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

// Turns the method and constructor declarations of a compilation unit into Stats
public class DeclarationCollector {

    private static final Logger LOGGER = Logger.getLogger(DeclarationCollector.class.getName());

    public static final String DEFAULT_PACKAGE = "<default>";
    public static final String BAD_RECEIVER = "BADRECV";
    public static final String CONSTRUCTOR_NAME = "<init>";

    private DeclarationCollector() {}

    public static List<Stat> buildStats(CompilationUnit cu, String fileName, List<Stat> stats) {
        String packageName = cu.getPackageDeclaration()
                .map(pd -> pd.getNameAsString())
                .orElse(DEFAULT_PACKAGE);

        for (TypeDeclaration<?> type : cu.getTypes()) {
            collectType(type, type.getNameAsString(), packageName, fileName, stats);
        }
        return stats;
    }

    // receiverType is null below an enum constant body, which has no nameable type
    private static void collectType(TypeDeclaration<?> type, String receiverType, String packageName,
                                    String fileName, List<Stat> stats) {
        if (type instanceof EnumDeclaration) {
            for (EnumConstantDeclaration constant : ((EnumDeclaration) type).getEntries()) {
                for (BodyDeclaration<?> member : constant.getClassBody()) {
                    collectMember(member, null, packageName, fileName, stats);
                }
            }
        }
        for (BodyDeclaration<?> member : type.getMembers()) {
            collectMember(member, receiverType, packageName, fileName, stats);
        }
    }

    private static void collectMember(BodyDeclaration<?> member, String receiverType, String packageName,
                                      String fileName, List<Stat> stats) {
        if (member instanceof TypeDeclaration) {
            TypeDeclaration<?> nested = (TypeDeclaration<?>) member;
            String nestedReceiver = receiverType == null ? null : receiverType + "." + nested.getNameAsString();
            collectType(nested, nestedReceiver, packageName, fileName, stats);
            return;
        }

        Optional<String> name = funcName(member, receiverType);
        if (name.isEmpty()) {
            return;
        }

        Optional<BlockStmt> body = DepthCalculator.getBody(member);
        if (body.isEmpty()) {
            LOGGER.log(Level.FINE, "Skipping {0} in {1}: no body", new Object[]{name.get(), fileName});
            return;
        }

        Position pos = member.getBegin().orElse(Position.HOME);
        stats.add(new Stat(packageName, name.get(), DepthCalculator.calculateDepth(body.get()),
                fileName, pos.line, pos.column));
    }

    /**
     * Name representation of a method or constructor: {@code (Type).name} for static methods,
     * {@code (*Type).name} for instance methods and constructors, {@code (BADRECV).name} when
     * the enclosing type has no name. Empty for members that are not callables.
     */
    public static Optional<String> funcName(BodyDeclaration<?> member, String receiverType) {
        if (member instanceof MethodDeclaration) {
            MethodDeclaration md = (MethodDeclaration) member;
            return Optional.of(String.format("(%s).%s", recvString(receiverType, !md.isStatic()), md.getNameAsString()));
        }
        if (member instanceof ConstructorDeclaration || member instanceof CompactConstructorDeclaration) {
            return Optional.of(String.format("(%s).%s", recvString(receiverType, true), CONSTRUCTOR_NAME));
        }
        return Optional.empty();
    }

    // "T", "*T", or "BADRECV"
    public static String recvString(String receiverType, boolean byReference) {
        if (receiverType == null || receiverType.isEmpty()) {
            return BAD_RECEIVER;
        }
        return byReference ? "*" + receiverType : receiverType;
    }
}
