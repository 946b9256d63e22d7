package ir.value;

public enum Opcode {
    // 整数二元运算
    ADD("add"),
    SUB("sub"),
    MUL("mul"),
    UDIV("udiv"),
    SDIV("sdiv"),
    UREM("urem"),
    SREM("srem"),
    SHL("shl"),
    LSHR("lshr"),
    ASHR("ashr"),
    AND("and"),
    OR("or"),
    XOR("xor"),

    // 整数比较，结果为 i1
    ULT("icmp ult"),
    ULE("icmp ule"),
    SLT("icmp slt"),
    SLE("icmp sle"),
    UGT("icmp ugt"),
    UGE("icmp uge"),
    SGT("icmp sgt"),
    SGE("icmp sge"),
    EQ("icmp eq"),
    NE("icmp ne"),

    SELECT("select"),

    // 位宽转换
    ZEXT("zext"),
    SEXT("sext"),
    TRUNC("trunc"),

    // 浮点
    FNEG("fneg"),
    FADD("fadd"),
    FSUB("fsub"),
    FMUL("fmul"),
    FDIV("fdiv"),
    FOLT("fcmp olt"),
    FOLE("fcmp ole"),
    FOGT("fcmp ogt"),
    FOGE("fcmp oge"),
    FONE("fcmp one"),
    ;

    private final String mnemonic;

    Opcode(String mnemonic) {
        this.mnemonic = mnemonic;
    }

    public String getMnemonic() {
        return mnemonic;
    }

    /** same-width operands, same-width result */
    public boolean isBinary() {
        switch (this) {
            case ADD: case SUB: case MUL: case UDIV: case SDIV: case UREM: case SREM:
            case SHL: case LSHR: case ASHR: case AND: case OR: case XOR:
            case FADD: case FSUB: case FMUL: case FDIV:
                return true;
            default:
                return false;
        }
    }

    /** same-width operands, i1 result */
    public boolean isCompare() {
        switch (this) {
            case ULT: case ULE: case SLT: case SLE: case UGT: case UGE: case SGT: case SGE:
            case EQ: case NE:
            case FOLT: case FOLE: case FOGT: case FOGE: case FONE:
                return true;
            default:
                return false;
        }
    }

    public boolean isCast() {
        return this == ZEXT || this == SEXT || this == TRUNC;
    }

    /** integer ops that read their operands as two's complement */
    public boolean isSigned() {
        switch (this) {
            case SDIV: case SREM: case ASHR:
            case SLT: case SLE: case SGT: case SGE:
                return true;
            default:
                return false;
        }
    }

    /**
     * Integer ops whose result may have bits set above a narrower logical
     * width even when both operands are zero there.
     */
    public boolean mayDirtyHighBits() {
        switch (this) {
            case ADD: case SUB: case MUL: case SHL:
            case UDIV: case SDIV: case SREM: case ASHR:
                return true;
            default:
                return false;
        }
    }

    public boolean isCommutative() {
        return this == ADD || this == MUL || this == AND || this == OR || this == XOR
                || this == EQ || this == NE || this == FADD || this == FMUL;
    }
}
