package com.connascence.plugins.java;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import com.connascence.ast.LineMap;
import com.connascence.ast.NodeTypes;
import com.connascence.ast.NormalizedNode;
import com.github.javaparser.Position;
import com.github.javaparser.Range;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.Modifier;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.comments.Comment;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.BooleanLiteralExpr;
import com.github.javaparser.ast.expr.CharLiteralExpr;
import com.github.javaparser.ast.expr.ConditionalExpr;
import com.github.javaparser.ast.expr.DoubleLiteralExpr;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.IntegerLiteralExpr;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.LongLiteralExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.Name;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.NullLiteralExpr;
import com.github.javaparser.ast.expr.SimpleName;
import com.github.javaparser.ast.expr.StringLiteralExpr;
import com.github.javaparser.ast.expr.SwitchExpr;
import com.github.javaparser.ast.expr.TextBlockLiteralExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.nodeTypes.NodeWithArguments;
import com.github.javaparser.ast.stmt.AssertStmt;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.BreakStmt;
import com.github.javaparser.ast.stmt.CatchClause;
import com.github.javaparser.ast.stmt.ContinueStmt;
import com.github.javaparser.ast.stmt.DoStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.LabeledStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.SwitchEntry;
import com.github.javaparser.ast.stmt.SwitchStmt;
import com.github.javaparser.ast.stmt.SynchronizedStmt;
import com.github.javaparser.ast.stmt.ThrowStmt;
import com.github.javaparser.ast.stmt.TryStmt;
import com.github.javaparser.ast.stmt.WhileStmt;
import com.github.javaparser.ast.type.Type;

/**
 * Maps a JavaParser compilation unit onto the shared node vocabulary. Node classes without a
 * dedicated mapping keep their own name in snake case ({@code ArrayAccessExpr -> array_access_expr}).
 */
class JavaTreeNormalizer {
    private final String source;
    private final LineMap lineMap;

    JavaTreeNormalizer(String source) {
        this.source = source;
        this.lineMap = new LineMap(source);
    }

    NormalizedNode normalize(CompilationUnit unit) {
        return new NormalizedNode(NodeTypes.MODULE, lineMap.span(0, source.length()), source, _children(unit));
    }

    private NormalizedNode _convert(Node node) {
        Optional<Range> range = node.getRange();
        if (range.isEmpty() || node instanceof Comment || node instanceof Modifier) {
            return null;
        }
        int start = _offset(range.get().begin);
        int end = _offset(range.get().end) + 1;

        if (node instanceof SimpleName || node instanceof Name || node instanceof NameExpr) {
            return _leaf(NodeTypes.IDENTIFIER, start, end);
        }
        if (node instanceof Type) {
            return _leaf(NodeTypes.TYPE, start, end);
        }
        if (node instanceof CallableDeclaration) {
            return _callable((CallableDeclaration<?>) node, start, end);
        }
        if (node instanceof TypeDeclaration) {
            TypeDeclaration<?> type = (TypeDeclaration<?>) node;
            List<NormalizedNode> children = new ArrayList<>();
            children.add(_convert(type.getName()));
            for (Node member : type.getChildNodes()) {
                if (member != type.getName() && !(member instanceof Type)) {
                    children.add(_convert(member));
                }
            }
            return _node(NodeTypes.CLASS_DEFINITION, start, end, children);
        }
        if (node instanceof Parameter) {
            Parameter parameter = (Parameter) node;
            return _node(NodeTypes.PARAMETER, start, end,
                    _list(_convert(parameter.getType()), _convert(parameter.getName())));
        }
        if (node instanceof VariableDeclarator) {
            VariableDeclarator variable = (VariableDeclarator) node;
            if (variable.getInitializer().isPresent()) {
                return _node(NodeTypes.INIT_DECLARATOR, start, end,
                        _list(_convert(variable.getName()), _convert(variable.getInitializer().get())));
            }
            return _node("variable_declarator", start, end, _list(_convert(variable.getName())));
        }
        if (node instanceof IfStmt) {
            IfStmt ifStmt = (IfStmt) node;
            List<NormalizedNode> children = _list(_convert(ifStmt.getCondition()), _convert(ifStmt.getThenStmt()));
            ifStmt.getElseStmt().ifPresent(elseStmt -> {
                NormalizedNode branch = _convert(elseStmt);
                if (branch != null) {
                    children.add(new NormalizedNode(NodeTypes.ELSE_CLAUSE, branch.getSpan(), source, List.of(branch)));
                }
            });
            return _node(NodeTypes.IF_STATEMENT, start, end, children);
        }
        if (node instanceof MethodCallExpr) {
            MethodCallExpr call = (MethodCallExpr) node;
            NormalizedNode name = _convert(call.getName());
            NormalizedNode callee = name;
            if (call.getScope().isPresent()) {
                NormalizedNode scope = _convert(call.getScope().get());
                if (scope != null) {
                    callee = _node(NodeTypes.ATTRIBUTE, scope.getSpan().getStartOffset(),
                            name.getSpan().getEndOffset(), _list(scope, name));
                }
            }
            List<NormalizedNode> arguments = new ArrayList<>();
            for (Expression argument : call.getArguments()) {
                arguments.add(_convert(argument));
            }
            return _node(NodeTypes.CALL, start, end,
                    _list(callee, _parenthesized(NodeTypes.ARGUMENT_LIST, arguments, name.getSpan().getEndOffset())));
        }
        if (node instanceof FieldAccessExpr) {
            FieldAccessExpr access = (FieldAccessExpr) node;
            return _node(NodeTypes.ATTRIBUTE, start, end,
                    _list(_convert(access.getScope()), _convert(access.getName())));
        }
        if (node instanceof NodeWithArguments) {
            NodeList<Expression> arguments = ((NodeWithArguments<?>) node).getArguments();
            List<NormalizedNode> children = new ArrayList<>();
            NormalizedNode previous = null;
            for (Node child : node.getChildNodes()) {
                if (!arguments.contains(child)) {
                    NormalizedNode converted = _convert(child);
                    if (converted != null) {
                        children.add(converted);
                        if (previous == null) {
                            previous = converted;
                        }
                    }
                }
            }
            children.add(_arguments(arguments, previous));
            return _node(_typeOf(node), start, end, children);
        }
        return _node(_typeOf(node), start, end, _children(node));
    }

    private NormalizedNode _callable(CallableDeclaration<?> callable, int start, int end) {
        List<NormalizedNode> children = new ArrayList<>();
        if (callable instanceof MethodDeclaration) {
            children.add(_convert(((MethodDeclaration) callable).getType()));
        }
        NormalizedNode name = _convert(callable.getName());
        children.add(name);

        List<NormalizedNode> params = new ArrayList<>();
        for (Parameter parameter : callable.getParameters()) {
            params.add(_convert(parameter));
        }
        params.removeIf(p -> p == null);
        children.add(_parenthesized(NodeTypes.PARAMETERS, params, name.getSpan().getEndOffset()));

        Optional<BlockStmt> body = callable instanceof MethodDeclaration
                ? ((MethodDeclaration) callable).getBody()
                : Optional.of(((ConstructorDeclaration) callable).getBody());
        body.ifPresent(block -> children.add(_convert(block)));
        return _node(NodeTypes.FUNCTION_DEFINITION, start, end, children);
    }

    private NormalizedNode _arguments(NodeList<Expression> arguments, NormalizedNode anchor) {
        List<NormalizedNode> converted = new ArrayList<>();
        for (Expression argument : arguments) {
            NormalizedNode node = _convert(argument);
            if (node != null) {
                converted.add(node);
            }
        }
        return _group(NodeTypes.ARGUMENT_LIST, converted, anchor);
    }

    /**
     * A synthesized node covering the parenthesized list that opens at or after {@code from}.
     */
    private NormalizedNode _parenthesized(String type, List<NormalizedNode> members, int from) {
        int open = source.indexOf('(', from);
        if (open < 0) {
            return _group(type, members, null);
        }
        int depth = 0;
        char quote = 0;
        for (int i = open; i < source.length(); i++) {
            char c = source.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '(') {
                depth++;
            } else if (c == ')' && --depth == 0) {
                return _node(type, open, i + 1, members);
            }
        }
        return _group(type, members, null);
    }

    /**
     * A synthesized node spanning its members, or an empty node right after the anchor.
     */
    private NormalizedNode _group(String type, List<NormalizedNode> members, NormalizedNode anchor) {
        if (members.isEmpty()) {
            int at = anchor == null ? 0 : anchor.getSpan().getEndOffset();
            return _node(type, at, at, members);
        }
        return _node(type, members.get(0).getSpan().getStartOffset(),
                members.get(members.size() - 1).getSpan().getEndOffset(), members);
    }

    private List<NormalizedNode> _children(Node node) {
        List<NormalizedNode> children = new ArrayList<>();
        for (Node child : node.getChildNodes()) {
            NormalizedNode converted = _convert(child);
            if (converted != null) {
                children.add(converted);
            }
        }
        return children;
    }

    private String _typeOf(Node node) {
        if (node instanceof CompilationUnit) return NodeTypes.MODULE;
        if (node instanceof ImportDeclaration) return NodeTypes.IMPORT_STATEMENT;
        if (node instanceof BlockStmt) return NodeTypes.BLOCK;
        if (node instanceof ForStmt || node instanceof ForEachStmt) return NodeTypes.FOR_STATEMENT;
        if (node instanceof WhileStmt) return NodeTypes.WHILE_STATEMENT;
        if (node instanceof DoStmt) return NodeTypes.DO_STATEMENT;
        if (node instanceof SwitchStmt || node instanceof SwitchExpr) return NodeTypes.SWITCH_STATEMENT;
        if (node instanceof SwitchEntry) return NodeTypes.CASE_CLAUSE;
        if (node instanceof TryStmt) return NodeTypes.TRY_STATEMENT;
        if (node instanceof CatchClause) return NodeTypes.EXCEPT_CLAUSE;
        if (node instanceof SynchronizedStmt) return NodeTypes.WITH_STATEMENT;
        if (node instanceof ReturnStmt) return NodeTypes.RETURN_STATEMENT;
        if (node instanceof AssertStmt) return NodeTypes.ASSERT_STATEMENT;
        if (node instanceof ExpressionStmt) return NodeTypes.EXPRESSION_STATEMENT;
        if (node instanceof BreakStmt) return NodeTypes.BREAK_STATEMENT;
        if (node instanceof ContinueStmt) return NodeTypes.CONTINUE_STATEMENT;
        if (node instanceof ThrowStmt) return NodeTypes.RAISE_STATEMENT;
        if (node instanceof LabeledStmt) return NodeTypes.LABELED_STATEMENT;
        if (node instanceof FieldDeclaration || node instanceof VariableDeclarationExpr) return NodeTypes.DECLARATION;
        if (node instanceof EnclosedExpr) return NodeTypes.PARENTHESIZED_EXPRESSION;
        if (node instanceof ConditionalExpr) return NodeTypes.CONDITIONAL_EXPRESSION;
        if (node instanceof LambdaExpr) return "lambda";
        if (node instanceof AssignExpr) {
            return ((AssignExpr) node).getOperator() == AssignExpr.Operator.ASSIGN
                    ? NodeTypes.ASSIGNMENT : NodeTypes.AUGMENTED_ASSIGNMENT;
        }
        if (node instanceof BinaryExpr) {
            return _binaryType(((BinaryExpr) node).getOperator());
        }
        if (node instanceof UnaryExpr) {
            return _unaryType(((UnaryExpr) node).getOperator());
        }
        if (node instanceof IntegerLiteralExpr || node instanceof LongLiteralExpr) return NodeTypes.INTEGER;
        if (node instanceof DoubleLiteralExpr) return NodeTypes.FLOAT;
        if (node instanceof StringLiteralExpr || node instanceof TextBlockLiteralExpr) return NodeTypes.STRING;
        if (node instanceof CharLiteralExpr) return NodeTypes.CHAR_LITERAL;
        if (node instanceof BooleanLiteralExpr) {
            return ((BooleanLiteralExpr) node).getValue() ? NodeTypes.TRUE : NodeTypes.FALSE;
        }
        if (node instanceof NullLiteralExpr) return NodeTypes.NONE;
        return _snakeCase(node.getClass().getSimpleName());
    }

    private static String _binaryType(BinaryExpr.Operator operator) {
        return switch (operator) {
            case EQUALS, NOT_EQUALS, LESS, LESS_EQUALS, GREATER, GREATER_EQUALS -> NodeTypes.COMPARISON_OPERATOR;
            case AND, OR -> NodeTypes.BOOLEAN_OPERATOR;
            default -> NodeTypes.BINARY_OPERATOR;
        };
    }

    private static String _unaryType(UnaryExpr.Operator operator) {
        return switch (operator) {
            case LOGICAL_COMPLEMENT -> NodeTypes.NOT_OPERATOR;
            case PLUS, MINUS, BITWISE_COMPLEMENT -> NodeTypes.UNARY_OPERATOR;
            default -> "update_expression";
        };
    }

    static String _snakeCase(String simpleName) {
        StringBuilder result = new StringBuilder();
        for (int i = 0; i < simpleName.length(); i++) {
            char c = simpleName.charAt(i);
            if (Character.isUpperCase(c)) {
                if (i > 0) {
                    result.append('_');
                }
                result.append(Character.toLowerCase(c));
            } else {
                result.append(c);
            }
        }
        return result.toString();
    }

    private NormalizedNode _node(String type, int start, int end, List<NormalizedNode> children) {
        List<NormalizedNode> ordered = new ArrayList<>(children);
        ordered.removeIf(child -> child == null);
        ordered.sort(Comparator.comparingInt(child -> child.getSpan().getStartOffset()));
        return new NormalizedNode(type, lineMap.span(start, end), source, ordered);
    }

    private NormalizedNode _leaf(String type, int start, int end) {
        return new NormalizedNode(type, lineMap.span(start, end), source);
    }

    private int _offset(Position position) {
        return lineMap.offsetOf(position.line, position.column);
    }

    private static List<NormalizedNode> _list(NormalizedNode... nodes) {
        List<NormalizedNode> result = new ArrayList<>();
        for (NormalizedNode node : nodes) {
            if (node != null) {
                result.add(node);
            }
        }
        return result;
    }
}
