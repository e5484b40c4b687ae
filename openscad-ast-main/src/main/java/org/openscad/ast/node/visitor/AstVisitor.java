package org.openscad.ast.node.visitor;

import org.openscad.ast.node.AssertNode;
import org.openscad.ast.node.AssignmentNode;
import org.openscad.ast.node.BinaryExpressionNode;
import org.openscad.ast.node.ChildrenNode;
import org.openscad.ast.node.CircleNode;
import org.openscad.ast.node.ColorNode;
import org.openscad.ast.node.ConditionalExpressionNode;
import org.openscad.ast.node.CubeNode;
import org.openscad.ast.node.CylinderNode;
import org.openscad.ast.node.DifferenceNode;
import org.openscad.ast.node.EachNode;
import org.openscad.ast.node.EchoNode;
import org.openscad.ast.node.ErrorNode;
import org.openscad.ast.node.ForLoopNode;
import org.openscad.ast.node.FunctionCallNode;
import org.openscad.ast.node.FunctionDefinitionNode;
import org.openscad.ast.node.FunctionLiteralNode;
import org.openscad.ast.node.HullNode;
import org.openscad.ast.node.IfNode;
import org.openscad.ast.node.IncludeNode;
import org.openscad.ast.node.IndexExpressionNode;
import org.openscad.ast.node.IntersectionNode;
import org.openscad.ast.node.LetExpressionNode;
import org.openscad.ast.node.LetNode;
import org.openscad.ast.node.LinearExtrudeNode;
import org.openscad.ast.node.ListComprehensionNode;
import org.openscad.ast.node.LiteralNode;
import org.openscad.ast.node.MemberAccessNode;
import org.openscad.ast.node.MinkowskiNode;
import org.openscad.ast.node.MirrorNode;
import org.openscad.ast.node.ModifierNode;
import org.openscad.ast.node.ModuleDefinitionNode;
import org.openscad.ast.node.ModuleInstantiationNode;
import org.openscad.ast.node.MultmatrixNode;
import org.openscad.ast.node.OffsetNode;
import org.openscad.ast.node.PolygonNode;
import org.openscad.ast.node.PolyhedronNode;
import org.openscad.ast.node.RangeExpressionNode;
import org.openscad.ast.node.ResizeNode;
import org.openscad.ast.node.RotateExtrudeNode;
import org.openscad.ast.node.RotateNode;
import org.openscad.ast.node.ScaleNode;
import org.openscad.ast.node.SphereNode;
import org.openscad.ast.node.SquareNode;
import org.openscad.ast.node.TextNode;
import org.openscad.ast.node.TranslateNode;
import org.openscad.ast.node.UnaryExpressionNode;
import org.openscad.ast.node.UnionNode;
import org.openscad.ast.node.UseNode;
import org.openscad.ast.node.VariableNode;
import org.openscad.ast.node.VectorExpressionNode;

/**
 * A visitor over every AST node type, with a return value and an argument.
 *
 * @param <R> the return type
 * @param <A> the argument type
 */
public interface AstVisitor<R, A> {

    // primitives

    R visit(CubeNode n, A arg);

    R visit(SphereNode n, A arg);

    R visit(CylinderNode n, A arg);

    R visit(PolyhedronNode n, A arg);

    R visit(PolygonNode n, A arg);

    R visit(CircleNode n, A arg);

    R visit(SquareNode n, A arg);

    R visit(TextNode n, A arg);

    // transforms and extrusions

    R visit(TranslateNode n, A arg);

    R visit(RotateNode n, A arg);

    R visit(ScaleNode n, A arg);

    R visit(MirrorNode n, A arg);

    R visit(MultmatrixNode n, A arg);

    R visit(ColorNode n, A arg);

    R visit(OffsetNode n, A arg);

    R visit(ResizeNode n, A arg);

    R visit(LinearExtrudeNode n, A arg);

    R visit(RotateExtrudeNode n, A arg);

    // boolean operations

    R visit(UnionNode n, A arg);

    R visit(DifferenceNode n, A arg);

    R visit(IntersectionNode n, A arg);

    R visit(HullNode n, A arg);

    R visit(MinkowskiNode n, A arg);

    // control structures

    R visit(IfNode n, A arg);

    R visit(ForLoopNode n, A arg);

    R visit(LetNode n, A arg);

    R visit(EachNode n, A arg);

    // definitions and statements

    R visit(ModuleDefinitionNode n, A arg);

    R visit(FunctionDefinitionNode n, A arg);

    R visit(AssignmentNode n, A arg);

    R visit(ModuleInstantiationNode n, A arg);

    R visit(ChildrenNode n, A arg);

    R visit(EchoNode n, A arg);

    R visit(AssertNode n, A arg);

    R visit(IncludeNode n, A arg);

    R visit(UseNode n, A arg);

    R visit(ModifierNode n, A arg);

    // expressions

    R visit(LiteralNode n, A arg);

    R visit(VariableNode n, A arg);

    R visit(BinaryExpressionNode n, A arg);

    R visit(UnaryExpressionNode n, A arg);

    R visit(ConditionalExpressionNode n, A arg);

    R visit(VectorExpressionNode n, A arg);

    R visit(IndexExpressionNode n, A arg);

    R visit(MemberAccessNode n, A arg);

    R visit(RangeExpressionNode n, A arg);

    R visit(LetExpressionNode n, A arg);

    R visit(ListComprehensionNode n, A arg);

    R visit(FunctionCallNode n, A arg);

    R visit(FunctionLiteralNode n, A arg);

    // errors

    R visit(ErrorNode n, A arg);
}
