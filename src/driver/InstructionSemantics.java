package driver;

import com.microsoft.z3.Expr;

/**
 * One instruction of a semantics file: its name, the width of one result
 * lane and the formula of its whole result.
 *
 * @param line line of the {@code #intrinsic} header, for messages
 */
public record InstructionSemantics(String name, int laneWidth, Expr<?> formula, int line) {
}
