package org.csu.minipy.compiler.ir;

import org.csu.minipy.common.exception.LoweringException;
import org.csu.minipy.compiler.ir.instruction.AssignInstruction;
import org.csu.minipy.compiler.ir.instruction.BinaryOpInstruction;
import org.csu.minipy.compiler.ir.instruction.CallInstruction;
import org.csu.minipy.compiler.ir.instruction.CondJumpInstruction;
import org.csu.minipy.compiler.ir.instruction.JumpInstruction;
import org.csu.minipy.compiler.ir.instruction.LabelInstruction;
import org.csu.minipy.compiler.ir.instruction.MethodCallInstruction;
import org.csu.minipy.compiler.ir.instruction.NewInstruction;
import org.csu.minipy.compiler.ir.instruction.ReturnInstruction;
import org.csu.minipy.compiler.ir.instruction.StoreInstruction;
import org.csu.minipy.compiler.ir.instruction.UnaryOpInstruction;
import org.csu.minipy.compiler.ir.operand.AttributePath;
import org.csu.minipy.compiler.ir.operand.Literal;
import org.csu.minipy.compiler.ir.operand.Operand;
import org.csu.minipy.compiler.ir.operand.Temp;
import org.csu.minipy.compiler.ir.operand.Variable;
import org.csu.minipy.compiler.parser.ast.AssignNode;
import org.csu.minipy.compiler.parser.ast.AttributeNode;
import org.csu.minipy.compiler.parser.ast.BinaryExpressionNode;
import org.csu.minipy.compiler.parser.ast.BreakNode;
import org.csu.minipy.compiler.parser.ast.CallNode;
import org.csu.minipy.compiler.parser.ast.ClassDefNode;
import org.csu.minipy.compiler.parser.ast.ConstantNode;
import org.csu.minipy.compiler.parser.ast.ContinueNode;
import org.csu.minipy.compiler.parser.ast.ExpressionNode;
import org.csu.minipy.compiler.parser.ast.ExpressionStatementNode;
import org.csu.minipy.compiler.parser.ast.FunctionDefNode;
import org.csu.minipy.compiler.parser.ast.IfNode;
import org.csu.minipy.compiler.parser.ast.MethodCallNode;
import org.csu.minipy.compiler.parser.ast.ModuleNode;
import org.csu.minipy.compiler.parser.ast.NameNode;
import org.csu.minipy.compiler.parser.ast.PassNode;
import org.csu.minipy.compiler.parser.ast.ReturnNode;
import org.csu.minipy.compiler.parser.ast.StatementNode;
import org.csu.minipy.compiler.parser.ast.UnaryExpressionNode;
import org.csu.minipy.compiler.parser.ast.WhileNode;

import java.util.ArrayList;
import java.util.List;

/**
 * @description: IR 生成器
 * 负责将 AST 降级为三地址码。每个函数 (方法) 拥有独立的作用域，临时变量与标签均从 1 开始编号；
 * 模块顶层语句共享一个作用域。函数按声明顺序收集，外层函数先于其内部定义的函数。
 *
 * 实例状态只在一次 {@link #generate(ModuleNode)} 调用内有效，不要在线程间共享同一个实例。
 */
public class IrGenerator {

    private static final String CONSTRUCTOR_NAME = "__init__";

    private List<IrFunction> functions;

    public IrProgram generate(ModuleNode module) {
        functions = new ArrayList<>();
        LoweringScope moduleScope = new LoweringScope(null);
        lowerBlock(module.body(), moduleScope);
        return new IrProgram(moduleScope.getInstructions(), functions);
    }

    // --- 语句 ---

    private void lowerBlock(List<StatementNode> statements, LoweringScope scope) {
        for (StatementNode statement : statements) {
            lowerStatement(statement, scope);
        }
    }

    private void lowerStatement(StatementNode statement, LoweringScope scope) {
        if (statement instanceof FunctionDefNode def) {
            lowerFunction(def, scope.qualify(def.name()), false);
            return;
        }
        if (statement instanceof ClassDefNode classDef) {
            lowerClass(classDef, scope);
            return;
        }
        if (statement instanceof AssignNode assign) {
            lowerAssign(assign, scope);
            return;
        }
        if (statement instanceof IfNode ifNode) {
            lowerIf(ifNode, scope);
            return;
        }
        if (statement instanceof WhileNode whileNode) {
            lowerWhile(whileNode, scope);
            return;
        }
        if (statement instanceof ReturnNode ret) {
            lowerReturn(ret, scope);
            return;
        }
        if (statement instanceof BreakNode || statement instanceof ContinueNode) {
            lowerLoopControl(statement, scope);
            return;
        }
        if (statement instanceof PassNode) {
            return;
        }
        if (statement instanceof ExpressionStatementNode exprStmt) {
            Operand value = lowerExpression(exprStmt.expression(), scope);
            // 裸的名字、字面量或属性引用也需要落到一条指令上
            if (!(value instanceof Temp)) {
                scope.emit(new AssignInstruction(scope.newTemp(), value));
            }
            return;
        }
        throw new LoweringException("Unsupported statement: " + statement.kind(), statement.position());
    }

    private void lowerFunction(FunctionDefNode def, String qualifiedName, boolean constructor) {
        // 先占位，保证外层函数排在其嵌套函数之前
        int slot = functions.size();
        functions.add(null);

        LoweringScope scope = new LoweringScope(qualifiedName);
        lowerBlock(def.body(), scope);
        if (constructor && !scope.endsWithReturn()) {
            scope.emit(new ReturnInstruction(null));
        }
        functions.set(slot, new IrFunction(qualifiedName, def.parameters(), scope.getInstructions()));
    }

    private void lowerClass(ClassDefNode classDef, LoweringScope scope) {
        String className = scope.qualify(classDef.name());
        for (FunctionDefNode method : classDef.methods()) {
            lowerFunction(method, className + "." + method.name(), CONSTRUCTOR_NAME.equals(method.name()));
        }
    }

    private void lowerAssign(AssignNode assign, LoweringScope scope) {
        Operand value = lowerExpression(assign.value(), scope);
        Operand target;
        if (assign.target() instanceof NameNode name) {
            target = new Variable(name.identifier());
        } else if (assign.target() instanceof AttributeNode attribute) {
            target = new AttributePath(lowerExpression(attribute.receiver(), scope), attribute.name());
        } else {
            throw new LoweringException("Invalid assignment target: " + assign.target().kind(), assign.position());
        }
        scope.emit(new StoreInstruction(value, target));
    }

    /*
     *     if c jump Lthen
     *     <else>
     *     jump Lend
     * Lthen:
     *     <then>
     * Lend:
     */
    private void lowerIf(IfNode ifNode, LoweringScope scope) {
        Operand condition = lowerExpression(ifNode.test(), scope);
        String thenLabel = scope.newLabel();
        String endLabel = scope.newLabel();
        scope.emit(new CondJumpInstruction(condition, thenLabel));
        lowerBlock(ifNode.elseBody(), scope);
        scope.emit(new JumpInstruction(endLabel));
        scope.emit(new LabelInstruction(thenLabel));
        lowerBlock(ifNode.thenBody(), scope);
        scope.emit(new LabelInstruction(endLabel));
    }

    /*
     * Lcond:
     *     <test>
     *     if c jump Lbody
     *     jump Lend
     * Lbody:
     *     <body>
     *     jump Lcond
     * Lend:
     */
    private void lowerWhile(WhileNode whileNode, LoweringScope scope) {
        String condLabel = scope.newLabel();
        String bodyLabel = scope.newLabel();
        String endLabel = scope.newLabel();
        scope.emit(new LabelInstruction(condLabel));
        Operand condition = lowerExpression(whileNode.test(), scope);
        scope.emit(new CondJumpInstruction(condition, bodyLabel));
        scope.emit(new JumpInstruction(endLabel));
        scope.emit(new LabelInstruction(bodyLabel));
        scope.enterLoop(condLabel, endLabel);
        lowerBlock(whileNode.body(), scope);
        scope.exitLoop();
        scope.emit(new JumpInstruction(condLabel));
        scope.emit(new LabelInstruction(endLabel));
    }

    // break -> jump Lend，continue -> jump Lcond (最内层循环)
    private void lowerLoopControl(StatementNode statement, LoweringScope scope) {
        boolean isBreak = statement instanceof BreakNode;
        LoweringScope.LoopLabels loop = scope.innermostLoop();
        if (loop == null) {
            throw new LoweringException((isBreak ? "'break'" : "'continue'") + " outside loop", statement.position());
        }
        String target = isBreak ? loop.endLabel() : loop.condLabel();
        scope.emit(new JumpInstruction(target));
    }

    private void lowerReturn(ReturnNode ret, LoweringScope scope) {
        if (scope.isModule()) {
            throw new LoweringException("'return' outside function", ret.position());
        }
        Operand value = ret.hasValue() ? lowerExpression(ret.value(), scope) : null;
        scope.emit(new ReturnInstruction(value));
    }

    // --- 表达式 ---

    private Operand lowerExpression(ExpressionNode expression, LoweringScope scope) {
        if (expression instanceof ConstantNode constant) {
            return new Literal(constant.type(), constant.text());
        }
        if (expression instanceof NameNode name) {
            return new Variable(name.identifier());
        }
        if (expression instanceof AttributeNode attribute) {
            return new AttributePath(lowerExpression(attribute.receiver(), scope), attribute.name());
        }
        if (expression instanceof BinaryExpressionNode binary) {
            Operand left = lowerExpression(binary.left(), scope);
            Operand right = lowerExpression(binary.right(), scope);
            Temp result = scope.newTemp();
            scope.emit(new BinaryOpInstruction(result, binary.operator(), left, right));
            return result;
        }
        if (expression instanceof UnaryExpressionNode unary) {
            Operand operand = lowerExpression(unary.operand(), scope);
            Temp result = scope.newTemp();
            scope.emit(new UnaryOpInstruction(result, unary.operator(), operand));
            return result;
        }
        if (expression instanceof CallNode call) {
            List<Operand> arguments = lowerArguments(call.arguments(), scope);
            Temp result = scope.newTemp();
            if (call.constructorCall()) {
                scope.emit(new NewInstruction(result, call.callee(), arguments));
            } else {
                scope.emit(new CallInstruction(result, call.callee(), arguments));
            }
            return result;
        }
        if (expression instanceof MethodCallNode methodCall) {
            Operand receiver = lowerExpression(methodCall.receiver(), scope);
            List<Operand> arguments = lowerArguments(methodCall.arguments(), scope);
            Temp result = scope.newTemp();
            scope.emit(new MethodCallInstruction(result, receiver, methodCall.methodName(), arguments));
            return result;
        }
        throw new LoweringException("Unsupported expression: " + expression.kind(), expression.position());
    }

    private List<Operand> lowerArguments(List<ExpressionNode> arguments, LoweringScope scope) {
        List<Operand> operands = new ArrayList<>(arguments.size());
        for (ExpressionNode argument : arguments) {
            operands.add(lowerExpression(argument, scope));
        }
        return operands;
    }
}
