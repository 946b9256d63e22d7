package lift;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

import java.math.BigInteger;
import java.util.HashSet;
import java.util.List;
import java.util.Map;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import com.microsoft.z3.BitVecExpr;
import com.microsoft.z3.BitVecSort;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.FuncDecl;

import exception.UnsupportedFormulaException;
import ir.IRDag;
import ir.IRInterpreter;
import ir.value.LiveIn;
import ir.value.Opcode;
import ir.value.Value;
import ir.value.constants.ConstantFloat;
import ir.value.instructions.BinOperator;
import ir.value.instructions.CastInst;
import ir.value.instructions.CmpInst;
import ir.value.instructions.Instruction;
import ir.value.instructions.SelectInst;
import pass.PassManager;

public class TranslatorTest {
    private Context ctx;
    private BitVecExpr a;
    private BitVecExpr b;

    @Before
    public void setUp() {
        ctx = new Context();
        a = ctx.mkBVConst("a", 32);
        b = ctx.mkBVConst("b", 32);
    }

    @After
    public void tearDown() {
        ctx.close();
    }

    private LiftResult translate(Expr<?> f, int laneWidth) {
        return new Translator(ctx).translateFormula(f, laneWidth);
    }

    private static Value output(LiftResult r, int lane) {
        return r.dag().get(r.outputs().get(lane));
    }

    private static boolean hasOpcode(IRDag dag, Opcode op) {
        for (Value v : dag.asMap().values()) {
            if (v instanceof Instruction inst && inst.opCode() == op) {
                return true;
            }
        }
        return false;
    }

    @Test
    public void extractionThroughZeroExtensionTruncatesTheLiveIn() {
        BitVecExpr x = ctx.mkBVConst("x32", 32);
        Expr<?> f = ctx.mkExtract(15, 0, ctx.mkZeroExt(32, x));

        LiftResult r = translate(f, 16);

        assertEquals(1, r.laneCount());
        CastInst trunc = (CastInst) output(r, 0);
        assertEquals(Opcode.TRUNC, trunc.opCode());
        assertEquals(16, trunc.getBitWidth());
        LiveIn in = (LiveIn) r.dag().get(trunc.getValue());
        assertEquals("x32", in.getVariable());
        assertEquals(0, in.getLo());
        assertEquals(32, in.getHi());
        assertEquals(2, r.dag().size());
    }

    @Test
    public void addOfNegatedOperandIsASub() {
        Expr<?> f = ctx.mkBVAdd(a, ctx.mkBVMul(Formulas.allOnes(ctx, 32), b));

        LiftResult r = translate(f, 32);

        BinOperator sub = (BinOperator) output(r, 0);
        assertEquals(Opcode.SUB, sub.opCode());
        assertEquals(32, sub.getBitWidth());
        assertEquals("a", ((LiveIn) r.dag().get(sub.getLhs())).getVariable());
        assertEquals("b", ((LiveIn) r.dag().get(sub.getRhs())).getVariable());
        assertFalse(hasOpcode(r.dag(), Opcode.ADD));
        assertFalse(hasOpcode(r.dag(), Opcode.MUL));
    }

    @Test
    public void fourLaneConcatenationGivesFourIndependentOutputs() {
        Expr<?> f = ctx.mkConcat(ctx.mkConcat(ctx.mkBVAdd(a, b), ctx.mkBVAND(a, b)),
                ctx.mkConcat(ctx.mkBVXOR(a, b), ctx.mkBVMul(a, b)));

        LiftResult r = translate(f, 32);

        assertEquals(4, r.laneCount());
        assertEquals(4, new HashSet<>(r.outputs()).size());
        IRInterpreter interpreter = new IRInterpreter(r.dag(),
                Map.of("a", BigInteger.valueOf(5), "b", BigInteger.valueOf(3)));
        // 最高位的 lane 在前
        assertEquals(8L, interpreter.evaluate(r.outputs().get(0)));
        assertEquals(1L, interpreter.evaluate(r.outputs().get(1)));
        assertEquals(6L, interpreter.evaluate(r.outputs().get(2)));
        assertEquals(15L, interpreter.evaluate(r.outputs().get(3)));
        for (int lane = 0; lane < 4; lane++) {
            assertEquals(32, output(r, lane).getBitWidth());
        }
    }

    @Test
    public void alwaysTrueConditionLowersToTheThenArm() {
        BitVecExpr x = ctx.mkBVConst("x", 32);
        Expr<?> cond = ctx.mkBVULE(ctx.mkBVAND(x, ctx.mkBV(0x0F, 32)), ctx.mkBV(0x0F, 32));
        Expr<?> f = Formulas.ite(ctx, cond, ctx.mkBVAdd(a, b), ctx.mkBVMul(a, b));

        LiftResult r = new Lifter(ctx, PassManager.create(true)).lift(f, 32);

        assertEquals(Opcode.ADD, ((Instruction) output(r, 0)).opCode());
        assertFalse(hasOpcode(r.dag(), Opcode.SELECT));
        assertFalse(hasOpcode(r.dag(), Opcode.MUL));
    }

    @Test
    public void unoptimizedConditionalIsASelect() {
        BitVecExpr x = ctx.mkBVConst("x", 32);
        Expr<?> cond = ctx.mkBVULT(x, a);
        Expr<?> f = Formulas.ite(ctx, cond, x, a);

        LiftResult r = translate(f, 32);

        SelectInst select = (SelectInst) output(r, 0);
        CmpInst cmp = (CmpInst) r.dag().get(select.getCondition());
        assertEquals(Opcode.ULT, cmp.getPredicate());
        assertEquals(1, cmp.getBitWidth());
    }

    @Test
    public void sharedSubtermsAreLoweredOnce() {
        Expr<BitVecSort> sum = ctx.mkBVAdd(a, b);
        Expr<?> f = ctx.mkBVXOR(ctx.mkBVMul(sum, sum), sum);

        LiftResult r = translate(f, 32);

        // a, b, add, mul, xor
        assertEquals(5, r.dag().size());
    }

    @Test
    public void notAndNegation() {
        BitVecExpr x = ctx.mkBVConst("x", 8);
        LiftResult not = translate(ctx.mkBVNot(x), 8);
        LiftResult neg = new Translator(ctx).translateFormula(ctx.mkBVNeg(x), 8);

        assertEquals(Opcode.XOR, ((Instruction) output(not, 0)).opCode());
        assertEquals(Opcode.SUB, ((Instruction) output(neg, 0)).opCode());
        IRInterpreter interpreter = new IRInterpreter(not.dag(), Map.of("x", BigInteger.valueOf(0x0F)));
        assertEquals(0xF0L, interpreter.evaluate(not.outputs().get(0)));
        interpreter = new IRInterpreter(neg.dag(), Map.of("x", BigInteger.ONE));
        assertEquals(0xFFL, interpreter.evaluate(neg.outputs().get(0)));
    }

    @Test
    public void negatedDisjunctionIsLoweredAsAConjunction() {
        LiftResult r = translate(ctx.mkBVNot(ctx.mkBVOR(a, b)), 32);

        assertEquals(Opcode.AND, ((Instruction) output(r, 0)).opCode());
        assertFalse(hasOpcode(r.dag(), Opcode.OR));
    }

    @Test
    public void provableSignExtensionConcatIsASext() {
        BitVecExpr x = ctx.mkBVConst("x", 16);
        Expr<?> sign = ctx.mkExtract(15, 15, x);
        Expr<?> f = ctx.mkConcat(ctx.mkRepeat(16, Formulas.bv(sign)), x);

        LiftResult r = translate(f, 32);

        CastInst sext = (CastInst) output(r, 0);
        assertEquals(Opcode.SEXT, sext.opCode());
        IRInterpreter interpreter = new IRInterpreter(r.dag(), Map.of("x", BigInteger.valueOf(0x8001)));
        assertEquals(0xFFFF8001L, interpreter.evaluate(r.outputs().get(0)));
    }

    @Test
    public void zeroConcatIsAZext() {
        BitVecExpr x = ctx.mkBVConst("x", 16);
        LiftResult r = translate(ctx.mkConcat(ctx.mkBV(0, 16), x), 32);

        assertEquals(Opcode.ZEXT, ((CastInst) output(r, 0)).opCode());
    }

    @Test
    public void signExtensionFromAnOddWidthFillsTheRegisterFirst() {
        BitVecExpr x = ctx.mkBVConst("x", 32);
        Expr<?> f = ctx.mkSignExt(20, ctx.mkExtract(11, 0, x));

        LiftResult r = translate(f, 32);

        assertTrue(hasOpcode(r.dag(), Opcode.SHL));
        assertTrue(hasOpcode(r.dag(), Opcode.ASHR));
        IRInterpreter interpreter = new IRInterpreter(r.dag(), Map.of("x", BigInteger.valueOf(0xF800)));
        assertEquals(0xFFFFF800L, interpreter.evaluate(r.outputs().get(0)));
    }

    @Test
    public void extractionOfACompoundValueShiftsAndTruncates() {
        Expr<?> f = ctx.mkExtract(23, 8, ctx.mkBVAdd(a, b));

        LiftResult r = translate(f, 16);

        CastInst trunc = (CastInst) output(r, 0);
        assertEquals(16, trunc.getBitWidth());
        BinOperator shift = (BinOperator) r.dag().get(trunc.getValue());
        assertEquals(Opcode.LSHR, shift.opCode());
        IRInterpreter interpreter = new IRInterpreter(r.dag(),
                Map.of("a", BigInteger.valueOf(0x00123400), "b", BigInteger.valueOf(0x00001100)));
        assertEquals(0x1245L, interpreter.evaluate(r.outputs().get(0)));
    }

    @Test
    public void naryReductionsAreFolded() {
        BitVecExpr c = ctx.mkBVConst("c", 32);
        Expr<?> f = ctx.mkBVAdd(ctx.mkBVAdd(a, b), c).simplify();

        LiftResult r = translate(f, 32);

        IRInterpreter interpreter = new IRInterpreter(r.dag(), Map.of(
                "a", BigInteger.ONE, "b", BigInteger.TWO, "c", BigInteger.valueOf(4)));
        assertEquals(7L, interpreter.evaluate(r.outputs().get(0)));
    }

    @Test
    public void floatPrimitivesBecomeFloatInstructions() {
        BitVecExpr x = ctx.mkBVConst("fx", 32);
        Expr<?> one = FloatPrimitives.literal(ctx, 1.0, 32);
        Expr<?> f = FloatPrimitives.floatOp(ctx, FloatPrimitives.FloatOp.ADD, 32, x, one);

        LiftResult r = translate(f, 32);

        BinOperator fadd = (BinOperator) output(r, 0);
        assertEquals(Opcode.FADD, fadd.opCode());
        assertTrue(r.dag().get(fadd.getRhs()) instanceof ConstantFloat);
        assertEquals(1.0, ((ConstantFloat) r.dag().get(fadd.getRhs())).getValue(), 0.0);
    }

    @Test
    public void integerAbsoluteValue() {
        BitVecExpr x = ctx.mkBVConst("x", 16);
        Expr<?> f = FloatPrimitives.abs(ctx, x, true);

        LiftResult r = translate(f, 16);

        IRInterpreter interpreter = new IRInterpreter(r.dag(), Map.of("x", BigInteger.valueOf(0xFFFB)));
        assertEquals(5L, interpreter.evaluate(r.outputs().get(0)));
    }

    @Test
    public void signedSaturationClamps() {
        BitVecExpr x = ctx.mkBVConst("x", 16);
        Expr<?> f = FloatPrimitives.saturate(ctx, x, new FloatPrimitives.Saturation(16, true, 8, true));

        LiftResult r = translate(f, 8);

        assertEquals(8, output(r, 0).getBitWidth());
        assertEquals(0x7FL, new IRInterpreter(r.dag(), Map.of("x", BigInteger.valueOf(300)))
                .evaluate(r.outputs().get(0)));
        assertEquals(0x80L, new IRInterpreter(r.dag(), Map.of("x", BigInteger.valueOf(0xFF00)))
                .evaluate(r.outputs().get(0)));
        assertEquals(0x12L, new IRInterpreter(r.dag(), Map.of("x", BigInteger.valueOf(0x12)))
                .evaluate(r.outputs().get(0)));
    }

    @Test(expected = UnsupportedFormulaException.class)
    public void extractionFromAWideCompoundIsUnsupported() {
        BitVecExpr w = ctx.mkBVConst("w", 128);
        translate(ctx.mkExtract(7, 0, ctx.mkBVAdd(w, w)), 8);
    }

    @Test(expected = UnsupportedFormulaException.class)
    public void concatWithNonZeroHighPartIsUnsupported() {
        BitVecExpr x = ctx.mkBVConst("x", 16);
        BitVecExpr y = ctx.mkBVConst("y", 16);
        translate(ctx.mkConcat(ctx.mkBVAdd(x, y), y), 32);
    }

    @Test(expected = UnsupportedFormulaException.class)
    public void unknownFunctionIsUnsupported() {
        FuncDecl<BitVecSort> g = ctx.mkFuncDecl("mystery", ctx.mkBitVecSort(32), ctx.mkBitVecSort(32));
        translate(ctx.mkApp(g, a), 32);
    }

    @Test(expected = UnsupportedFormulaException.class)
    public void signedModuloIsUnsupported() {
        translate(ctx.mkBVSMod(a, b), 32);
    }

    @Test(expected = IllegalStateException.class)
    public void translatorServesOneFormula() {
        Translator t = new Translator(ctx);
        t.translateFormula(a, 32);
        t.translateFormula(b, 32);
    }

    @Test
    public void outputsDifferWhenLanesDiffer() {
        LiftResult r = translate(ctx.mkConcat(a, b), 32);
        assertNotEquals(r.outputs().get(0), r.outputs().get(1));
        assertEquals(List.of(a, b), r.lanes());
    }

    private long evaluate(LiftResult r, long x, long y) {
        IRInterpreter interpreter = new IRInterpreter(r.dag(),
                Map.of("x", BigInteger.valueOf(x), "y", BigInteger.valueOf(y)));
        return interpreter.evaluate(r.outputs().get(0));
    }

    @Test
    public void borrowOfANarrowSubDoesNotLeakThroughZeroExtension() {
        BitVecExpr x = ctx.mkBVConst("x", 12);
        BitVecExpr y = ctx.mkBVConst("y", 12);
        Expr<?> f = ctx.mkZeroExt(20, ctx.mkBVSub(x, y));

        LiftResult r = translate(f, 32);

        assertEquals(0xFFFL, evaluate(r, 0, 1));
    }

    @Test
    public void narrowSliceComparesOnlyItsOwnBits() {
        BitVecExpr x = ctx.mkBVConst("x", 12);
        BitVecExpr y = ctx.mkBVConst("y", 12);
        Expr<?> f = ctx.mkITE(ctx.mkBVULT(ctx.mkExtract(9, 0, x), ctx.mkExtract(9, 0, y)), x, y);

        LiftResult r = translate(f, 12);

        // x[9:0] == 0 < 1 == y[9:0]
        assertEquals(0x400L, evaluate(r, 0x400, 1));
    }

    @Test
    public void signedOperationsOnANarrowWidthSeeTheSignBit() {
        BitVecExpr x = ctx.mkBVConst("x", 12);
        BitVecExpr y = ctx.mkBVConst("y", 12);

        assertEquals(1L, evaluate(translate(ctx.mkBVSLT(x, y), 1), 0x800, 1));
        assertEquals(0xF80L, evaluate(translate(ctx.mkBVASHR(x, y), 12), 0x800, 4));
        assertEquals(0x800L, evaluate(translate(ctx.mkBVSDiv(x, y), 12), 0x800, 0xFFF));
        assertEquals(0xFFEL, evaluate(translate(ctx.mkBVSRem(x, y), 12), 0xFFE, 5));
    }

    @Test
    public void unsignedDivisionByZeroIsAllOnesOfTheLogicalWidth() {
        BitVecExpr x = ctx.mkBVConst("x", 12);
        BitVecExpr y = ctx.mkBVConst("y", 12);

        assertEquals(0xFFFL, evaluate(translate(ctx.mkBVUDiv(x, y), 12), 7, 0));
    }

    @Test
    public void narrowShiftLeftDropsBitsPastItsWidth() {
        BitVecExpr x = ctx.mkBVConst("x", 12);
        BitVecExpr y = ctx.mkBVConst("y", 12);
        Expr<?> f = ctx.mkBVLSHR(ctx.mkBVSHL(x, y), y);

        // (0xFFF << 4) keeps 0xFF0 in 12 bits, >> 4 gives 0x0FF
        assertEquals(0x0FFL, evaluate(translate(f, 12), 0xFFF, 4));
    }
}
