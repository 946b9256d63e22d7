package lift;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.microsoft.z3.Expr;
import com.microsoft.z3.enumerations.Z3_decl_kind;

import exception.LoweringInvariantException;
import ir.Builder;
import ir.type.IntegerType;
import util.LoggingManager;
import util.logging.Logger;

/**
 * Every simple extraction {@code x[hi:lo]} seen while translating one formula.
 * Each one is handed out as a {@link ir.value.Slice} placeholder; once the
 * formula is translated, {@link #translateSlices(Builder)} merges each
 * live-in's slices into disjoint root slices and tells how every placeholder
 * is recovered from its root.
 */
public class ExtractionHistory {
    private static final Logger log = LoggingManager.getLogger(ExtractionHistory.class);

    private record Recorded(BitRange range, int placeholder) {
    }

    // live-in -> recorded slices, in recording order
    private final Map<Expr<?>, List<Recorded>> extractedSlices = new LinkedHashMap<>();

    /** an extraction whose operand is a bare free variable */
    public static boolean isSimpleExtraction(Expr<?> ext) {
        return Formulas.isAppOf(ext, Z3_decl_kind.Z3_OP_EXTRACT)
                && Formulas.isVar(ext.getArgs()[0]);
    }

    /**
     * Records {@code x[hi:lo]} as the half-open slice [lo, hi+1).
     *
     * @return id of the placeholder node standing for the slice
     */
    public int record(Expr<?> ext, Builder builder) {
        if (!isSimpleExtraction(ext)) {
            throw new IllegalArgumentException("not a simple extraction: " + ext);
        }
        Expr<?> x = ext.getArgs()[0];
        return record(new BitRange(x, Formulas.extractLo(ext), Formulas.extractHi(ext) + 1), builder);
    }

    /** a live-in used whole is a full-width self-extraction */
    public int recordVariable(Expr<?> x, Builder builder) {
        return record(new BitRange(x, 0, Formulas.size(x)), builder);
    }

    private int record(BitRange range, Builder builder) {
        int placeholder = builder.buildSlice(range.variableName(), range.lo(), range.hi());
        extractedSlices.computeIfAbsent(range.variable(), k -> new ArrayList<>())
                .add(new Recorded(range, placeholder));
        return placeholder;
    }

    /** recorded slices of {@code x}, in recording order */
    public List<BitRange> slicesOf(Expr<?> x) {
        List<BitRange> out = new ArrayList<>();
        for (Recorded r : extractedSlices.getOrDefault(x, List.of())) {
            out.add(r.range());
        }
        return out;
    }

    /**
     * Merges overlapping slices until no two buckets overlap. Buckets come out
     * sorted by their low bit.
     */
    public static List<BitRange> partition(List<BitRange> slices) {
        List<BitRange> partition = new ArrayList<>();
        for (BitRange s : slices) {
            BitRange merged = s;
            boolean changed = true;
            // 合并后可能与其它桶重叠，直到不动点
            while (changed) {
                changed = false;
                for (int i = 0; i < partition.size(); i++) {
                    if (merged.overlaps(partition.get(i))) {
                        merged = merged.union(partition.remove(i));
                        changed = true;
                        break;
                    }
                }
            }
            partition.add(merged);
        }
        partition.sort(Comparator.comparingInt(BitRange::lo));
        return partition;
    }

    /**
     * Materialises one live-in per root slice and lowers every recorded slice
     * against its root.
     *
     * @return placeholder id -> id of the value replacing it
     */
    public Map<Integer, Integer> translateSlices(Builder builder) {
        Map<Integer, Integer> translated = new HashMap<>();
        for (Map.Entry<Expr<?>, List<Recorded>> e : extractedSlices.entrySet()) {
            List<BitRange> partition = partition(slicesOf(e.getKey()));
            log.debug("root slices of {}: {}", Formulas.nameOf(e.getKey()), partition);

            Map<BitRange, Integer> roots = new HashMap<>();
            for (BitRange root : partition) {
                roots.put(root, builder.buildLiveIn(root.variableName(), root.lo(), root.hi()));
            }

            for (Recorded r : e.getValue()) {
                BitRange root = rootOf(r.range(), partition);
                translated.put(r.placeholder(), lower(r.range(), root, roots.get(root), builder));
            }
        }
        return translated;
    }

    private static BitRange rootOf(BitRange s, List<BitRange> partition) {
        for (BitRange root : partition) {
            if (root.contains(s)) {
                return root;
            }
        }
        throw new LoweringInvariantException("slice " + s + " is not covered by any root slice");
    }

    private static int lower(BitRange s, BitRange root, int rootValue, Builder builder) {
        IntegerType sliceType = IntegerType.ceil(s.size());
        int rootWidth = IntegerType.ceilWidth(root.size());
        if (root.size() < s.size() || sliceType.getBitWidth() > rootWidth) {
            throw LoweringInvariantException.sliceWiderThanRoot(s.toString(), root.toString());
        }
        if (s.equals(root)) {
            return rootValue;
        }
        int value = rootValue;
        int shift = s.lo() - root.lo();
        if (shift > 0) {
            value = builder.buildLShr(value, shift);
        }
        if (sliceType.getBitWidth() != rootWidth) {
            value = builder.buildTrunc(value, sliceType);
        }
        // 根的高位可能残留在切片的寄存器里
        if (s.hi() < root.hi()) {
            value = builder.buildMask(value, s.size());
        }
        return value;
    }
}
