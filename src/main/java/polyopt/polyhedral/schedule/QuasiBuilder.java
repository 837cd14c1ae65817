package polyopt.polyhedral.schedule;

import polyopt.Util.error.ToolkitFailure;
import polyopt.parser.ScheduleBaseVisitor;
import polyopt.parser.ScheduleParser;
import polyopt.polyhedral.affine.QuasiAffine;

/**
 * Quasi-affine expressions inside schedule strings.
 */
public class QuasiBuilder extends ScheduleBaseVisitor<QuasiAffine> {
    @Override
    public QuasiAffine visitNegQuasi(ScheduleParser.NegQuasiContext ctx) {
        return visit(ctx.quasi()).mul(-1);
    }

    @Override
    public QuasiAffine visitMulQuasi(ScheduleParser.MulQuasiContext ctx) {
        QuasiAffine lhs = visit(ctx.quasi(0));
        QuasiAffine rhs = visit(ctx.quasi(1));
        if (lhs.isConst()) {
            return rhs.mul(lhs.bias());
        }
        if (rhs.isConst()) {
            return lhs.mul(rhs.bias());
        }
        throw new ToolkitFailure("non-affine product " + ctx.getText());
    }

    @Override
    public QuasiAffine visitAddQuasi(ScheduleParser.AddQuasiContext ctx) {
        QuasiAffine rhs = visit(ctx.quasi(1));
        return visit(ctx.quasi(0)).add(ctx.op.getText().equals("-") ? rhs.mul(-1) : rhs);
    }

    @Override
    public QuasiAffine visitFloorQuasi(ScheduleParser.FloorQuasiContext ctx) {
        return visit(ctx.quasi()).floorDiv(Long.parseLong(ctx.IntLiteral().getText()));
    }

    @Override
    public QuasiAffine visitParenQuasi(ScheduleParser.ParenQuasiContext ctx) {
        return visit(ctx.quasi());
    }

    @Override
    public QuasiAffine visitNumberQuasi(ScheduleParser.NumberQuasiContext ctx) {
        return QuasiAffine.constant(Long.parseLong(ctx.IntLiteral().getText()));
    }

    @Override
    public QuasiAffine visitVariableQuasi(ScheduleParser.VariableQuasiContext ctx) {
        return QuasiAffine.variable(ctx.Identifier().getText());
    }
}
