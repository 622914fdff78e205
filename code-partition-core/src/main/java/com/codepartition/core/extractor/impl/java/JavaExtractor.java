package com.codepartition.core.extractor.impl.java;

import com.codepartition.core.extractor.ExtractionException;
import com.codepartition.core.extractor.SourceFile;
import com.codepartition.core.extractor.base.AbstractExtractor;
import com.codepartition.core.extractor.base.ExtractionBuilder;
import com.codepartition.core.model.EntityKind;
import com.codepartition.core.model.ImportBinding;
import com.codepartition.core.model.Language;
import com.codepartition.core.model.RelationKind;
import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.Range;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.CompactConstructorDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.EnumDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.RecordDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.ast.type.Type;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Extracts types, methods and constructors from Java source files using JavaParser.
 *
 * <p><b>Relations</b>
 * <ul>
 *   <li>imports (single type, static member and wildcard imports)</li>
 *   <li>method calls and {@code new} expressions</li>
 *   <li>{@code extends} / {@code implements}</li>
 *   <li>field, parameter and return types as references</li>
 * </ul>
 *
 * <p>Local and anonymous classes belong to the enclosing method. A file JavaParser
 * rejects is reported as a syntax error.
 */
public class JavaExtractor extends AbstractExtractor {

    private static final ParserConfiguration PARSER_CONFIGURATION = new ParserConfiguration()
        .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);

    @Override
    public String getId() {
        return "java";
    }

    @Override
    public Set<Language> getSupportedLanguages() {
        return Set.of(Language.JAVA);
    }

    @Override
    protected void parse(SourceFile source, ExtractionBuilder builder) throws ExtractionException {
        // JavaParser instances are not thread-safe
        JavaParser javaParser = new JavaParser(PARSER_CONFIGURATION);
        ParseResult<CompilationUnit> result = javaParser.parse(source.content());
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            String detail = result.getProblems().stream()
                .findFirst()
                .map(Problem::getVerboseMessage)
                .orElse("unknown parse problem");
            log.debug("Failed to parse Java file: {}", source.relativePath());
            result.getProblems().forEach(problem -> log.debug("  - {}", problem));
            throw new ExtractionException("Syntax error", detail);
        }

        CompilationUnit cu = result.getResult().get();
        builder.namespace(getPackageName(cu));
        extractImports(cu, builder);

        Owners owners = new Owners();
        for (TypeDeclaration<?> type : cu.getTypes()) {
            declareType(type, null, builder, owners);
        }
        extractRelations(cu, builder, owners);
    }

    private String getPackageName(CompilationUnit cu) {
        return cu.getPackageDeclaration()
            .map(pd -> pd.getNameAsString())
            .orElse("");
    }

    private void extractImports(CompilationUnit cu, ExtractionBuilder builder) {
        for (ImportDeclaration importDeclaration : cu.getImports()) {
            String name = importDeclaration.getNameAsString();
            if (importDeclaration.isAsterisk()) {
                builder.binding(ImportBinding.wildcard(name));
                if (importDeclaration.isStatic()) {
                    builder.reference("", name, RelationKind.IMPORT);
                }
                continue;
            }
            String simpleName = name.substring(name.lastIndexOf('.') + 1);
            builder.binding(ImportBinding.named(simpleName, name));
            if (importDeclaration.isStatic()) {
                int lastDot = name.lastIndexOf('.');
                builder.reference("", lastDot < 0 ? name : name.substring(0, lastDot), RelationKind.IMPORT);
            } else {
                builder.reference("", name, RelationKind.IMPORT);
            }
        }
    }

    private void declareType(TypeDeclaration<?> type, String parentLocalName, ExtractionBuilder builder,
                             Owners owners) {
        EntityKind kind = typeKind(type);
        Optional<int[]> offsets = offsets(type, builder);
        if (offsets.isEmpty()) {
            return;
        }
        String name = type.getNameAsString();
        String localName = builder.declare(name, name, kind, offsets.get()[0], offsets.get()[1], List.of(),
            parentLocalName);
        owners.put(type, localName);

        for (BodyDeclaration<?> member : type.getMembers()) {
            if (member instanceof TypeDeclaration<?> nested) {
                declareType(nested, localName, builder, owners);
            } else if (member instanceof MethodDeclaration method) {
                declareCallable(method, EntityKind.METHOD, localName, builder, owners);
            } else if (member instanceof ConstructorDeclaration constructor) {
                declareCallable(constructor, EntityKind.CONSTRUCTOR, localName, builder, owners);
            } else if (member instanceof CompactConstructorDeclaration compact) {
                offsets(compact, builder).ifPresent(range -> owners.put(compact, builder.declare(
                    compact.getNameAsString(), compact.getNameAsString(), EntityKind.CONSTRUCTOR,
                    range[0], range[1], List.of(), localName)));
            }
        }
    }

    private void declareCallable(CallableDeclaration<?> callable, EntityKind kind, String parentLocalName,
                                 ExtractionBuilder builder, Owners owners) {
        offsets(callable, builder).ifPresent(range -> {
            List<String> parameters = callable.getParameters().stream()
                .map(Parameter::getNameAsString)
                .toList();
            String name = callable.getNameAsString();
            owners.put(callable, builder.declare(name, name, kind, range[0], range[1], parameters,
                parentLocalName));
        });
    }

    private void extractRelations(CompilationUnit cu, ExtractionBuilder builder, Owners owners) {
        for (Node node : owners.declared()) {
            String owner = owners.get(node);
            if (node instanceof ClassOrInterfaceDeclaration clazz) {
                clazz.getExtendedTypes().forEach(t -> builder.reference(owner, t.getNameWithScope(), RelationKind.INHERIT));
                clazz.getImplementedTypes().forEach(t -> builder.reference(owner, t.getNameWithScope(), RelationKind.INHERIT));
            } else if (node instanceof EnumDeclaration enumDeclaration) {
                enumDeclaration.getImplementedTypes()
                    .forEach(t -> builder.reference(owner, t.getNameWithScope(), RelationKind.INHERIT));
            } else if (node instanceof RecordDeclaration record) {
                record.getImplementedTypes()
                    .forEach(t -> builder.reference(owner, t.getNameWithScope(), RelationKind.INHERIT));
                record.getParameters().forEach(p -> referenceTypes(p.getType(), owner, builder));
            } else if (node instanceof MethodDeclaration method) {
                referenceTypes(method.getType(), owner, builder);
                method.getParameters().forEach(p -> referenceTypes(p.getType(), owner, builder));
            } else if (node instanceof ConstructorDeclaration constructor) {
                constructor.getParameters().forEach(p -> referenceTypes(p.getType(), owner, builder));
            }
        }

        for (FieldDeclaration field : cu.findAll(FieldDeclaration.class)) {
            String owner = ownerOf(field, owners);
            field.getVariables().forEach(variable -> referenceTypes(variable.getType(), owner, builder));
        }
        for (MethodCallExpr call : cu.findAll(MethodCallExpr.class)) {
            builder.reference(ownerOf(call, owners), callTarget(call), RelationKind.CALL);
        }
        for (ObjectCreationExpr creation : cu.findAll(ObjectCreationExpr.class)) {
            builder.reference(ownerOf(creation, owners), creation.getType().getNameWithScope(), RelationKind.CALL);
        }
    }

    private void referenceTypes(Type type, String owner, ExtractionBuilder builder) {
        for (ClassOrInterfaceType referenced : type.findAll(ClassOrInterfaceType.class)) {
            builder.reference(owner, referenced.getNameWithScope(), RelationKind.REFERENCE);
        }
    }

    private String callTarget(MethodCallExpr call) {
        String name = call.getNameAsString();
        Optional<Expression> scope = call.getScope();
        if (scope.isEmpty() || scope.get().isThisExpr() || scope.get().isSuperExpr()) {
            return name;
        }
        Expression receiver = scope.get();
        if (receiver.isNameExpr() || receiver.isFieldAccessExpr() && isNameChain(receiver)) {
            return receiver.toString() + "." + name;
        }
        return name;
    }

    private boolean isNameChain(Expression expression) {
        if (expression.isNameExpr()) {
            return true;
        }
        return expression.isFieldAccessExpr() && isNameChain(expression.asFieldAccessExpr().getScope());
    }

    private String ownerOf(Node node, Owners owners) {
        Optional<Node> current = node.getParentNode();
        while (current.isPresent()) {
            String owner = owners.get(current.get());
            if (owner != null) {
                return owner;
            }
            current = current.get().getParentNode();
        }
        return "";
    }

    private EntityKind typeKind(TypeDeclaration<?> type) {
        if (type.isEnumDeclaration()) {
            return EntityKind.ENUM;
        }
        if (type.isAnnotationDeclaration()
                || type.isClassOrInterfaceDeclaration() && type.asClassOrInterfaceDeclaration().isInterface()) {
            return EntityKind.INTERFACE;
        }
        return EntityKind.CLASS;
    }

    /**
     * Declared nodes in declaration order, looked up by identity.
     */
    private static final class Owners {
        private final Map<Node, String> localNames = new IdentityHashMap<>();
        private final List<Node> order = new ArrayList<>();

        void put(Node node, String localName) {
            localNames.put(node, localName);
            order.add(node);
        }

        String get(Node node) {
            return localNames.get(node);
        }

        List<Node> declared() {
            return order;
        }
    }

    /**
     * Converts a node's line/column range into character offsets.
     */
    private Optional<int[]> offsets(Node node, ExtractionBuilder builder) {
        Optional<Range> range = node.getRange();
        if (range.isEmpty()) {
            return Optional.empty();
        }
        int start = builder.lineStart(range.get().begin.line) + range.get().begin.column - 1;
        int end = builder.lineStart(range.get().end.line) + range.get().end.column;
        return Optional.of(new int[] {start, end});
    }
}
