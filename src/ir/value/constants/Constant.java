package ir.value.constants;

import ir.type.IntegerType;
import ir.value.Value;

public abstract class Constant extends Value {
    protected Constant(IntegerType type) {
        super(type);
    }
}
