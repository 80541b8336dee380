package com.initialone.jconstify.ast;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.EnumConstantDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.expr.CharLiteralExpr;
import com.github.javaparser.ast.expr.StringLiteralExpr;
import com.github.javaparser.ast.expr.TextBlockLiteralExpr;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 对改写结果做事后检查，返回发现的问题（空列表表示通过）：
 * 1) 输出与输入完全相同
 * 2) .java 文件：输出无法被 JavaParser 解析
 * 3) .java 文件：常量声明之外仍有字符串 / 字符字面量
 *
 * 「常量声明之内」指 static final 字段（含接口字段）和枚举常量的参数；
 * 注解里的字面量不计（注解值本来就只能是常量表达式）。
 */
public class RewriteValidator {

    private final JavaParser parser;

    public RewriteValidator() {
        ParserConfiguration cfg = new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);
        this.parser = new JavaParser(cfg);
    }

    public List<String> validate(Path path, String before, String after) {
        List<String> problems = new ArrayList<>();
        if (after.equals(before)) {
            problems.add("output identical to input");
        }
        if (!path.getFileName().toString().endsWith(".java")) {
            return problems;
        }

        ParseResult<CompilationUnit> res = parser.parse(after);
        if (!res.isSuccessful() || res.getResult().isEmpty()) {
            String msg = res.getProblems().stream()
                    .findFirst()
                    .map(Problem::getVerboseMessage)
                    .map(s -> s.lines().findFirst().orElse(s))
                    .orElse("unknown");
            problems.add("output does not parse as Java: " + msg);
            return problems;
        }

        int residual = countResidualLiterals(res.getResult().get());
        if (residual > 0) {
            problems.add(residual + " literal(s) left outside constant declarations");
        }
        return problems;
    }

    int countResidualLiterals(CompilationUnit cu) {
        List<Node> literals = new ArrayList<>();
        literals.addAll(cu.findAll(StringLiteralExpr.class));
        literals.addAll(cu.findAll(CharLiteralExpr.class));
        literals.addAll(cu.findAll(TextBlockLiteralExpr.class));
        int n = 0;
        for (Node lit : literals) {
            if (!isInsideConstant(lit)) n++;
        }
        return n;
    }

    private static boolean isInsideConstant(Node lit) {
        if (lit.findAncestor(AnnotationExpr.class).isPresent()) return true;
        if (lit.findAncestor(EnumConstantDeclaration.class).isPresent()) return true;
        return lit.findAncestor(FieldDeclaration.class)
                .map(fd -> (fd.isStatic() && fd.isFinal()) || declaredInInterface(fd))
                .orElse(false);
    }

    private static boolean declaredInInterface(FieldDeclaration fd) {
        return fd.getParentNode()
                .filter(p -> p instanceof ClassOrInterfaceDeclaration)
                .map(p -> ((ClassOrInterfaceDeclaration) p).isInterface())
                .orElse(false);
    }
}
