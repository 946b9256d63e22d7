package ir;

import ir.value.instructions.*;

public interface InstructionVisitor<T> {
    T visit(BinOperator inst);

    T visit(CmpInst inst);

    T visit(CastInst inst);

    T visit(SelectInst inst);

    T visit(UnaryOperator inst);
}
