package com.codeviz.core.parser.impl.java;

import com.codeviz.core.parser.LanguageParser;
import com.codeviz.core.parser.SourceRange;
import com.codeviz.core.parser.SyntaxTree;
import com.codeviz.core.util.Languages;
import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Range;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.comments.Comment;
import com.github.javaparser.ast.expr.LambdaExpr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Java parser built on JavaParser rather than tree-sitter.
 *
 * <p>Functions are methods (abstract and interface methods included), constructors
 * and lambda expressions. JavaParser recovers from many syntax errors; when it
 * cannot build a compilation unit at all, {@link #parse(String)} fails.
 *
 * @since 1.0.0
 */
public class JavaSourceParser implements LanguageParser {

    private static final Logger log = LoggerFactory.getLogger(JavaSourceParser.class);

    // JavaParser instances keep per-parse state
    private final ThreadLocal<JavaParser> threadParser = ThreadLocal.withInitial(() -> new JavaParser(
        new ParserConfiguration().setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17)));

    @Override
    public String getLanguage() {
        return Languages.JAVA;
    }

    @Override
    public Set<String> getExtensions() {
        return Set.of("java");
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public SyntaxTree parse(String source) {
        ParseResult<CompilationUnit> result = threadParser.get().parse(source);
        Optional<CompilationUnit> unit = result.getResult();
        if (unit.isEmpty()) {
            String problems = result.getProblems().isEmpty()
                ? "no compilation unit"
                : result.getProblems().get(0).getVerboseMessage();
            throw new ParseException("JavaParser could not parse source: " + problems);
        }
        if (!result.isSuccessful() && log.isDebugEnabled()) {
            log.debug("JavaParser recovered from {} problems", result.getProblems().size());
        }
        return new JavaSyntaxTree(unit.get(), source, !result.isSuccessful());
    }

    @Override
    public List<SourceRange> findCommentRanges(SyntaxTree tree) {
        CompilationUnit unit = requireOwnTree(tree).compilationUnit();
        List<SourceRange> ranges = new ArrayList<>();
        for (Comment comment : unit.getAllComments()) {
            comment.getRange().map(JavaSourceParser::toSourceRange).ifPresent(ranges::add);
        }
        ranges.sort(SourceRange.BY_START);
        return ranges;
    }

    @Override
    public int countFunctions(SyntaxTree tree) {
        CompilationUnit unit = requireOwnTree(tree).compilationUnit();
        return unit.findAll(MethodDeclaration.class).size()
            + unit.findAll(ConstructorDeclaration.class).size()
            + unit.findAll(LambdaExpr.class).size();
    }

    /**
     * JavaParser positions are 1-based with an inclusive end column.
     */
    private static SourceRange toSourceRange(Range range) {
        return new SourceRange(
            range.begin.line - 1,
            range.begin.column - 1,
            range.end.line - 1,
            range.end.column
        );
    }

    private static JavaSyntaxTree requireOwnTree(SyntaxTree tree) {
        if (tree instanceof JavaSyntaxTree javaTree) {
            return javaTree;
        }
        throw new IllegalArgumentException("Tree was not produced by the java parser");
    }
}
