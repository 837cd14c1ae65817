package polyopt.polyhedral.affine;

import polyopt.Util.error.ToolkitFailure;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * One quasi-affine piece per statement, each over that statement's iterators
 * and the parameters. Fixed once constructed.
 */
public class UnionPwAff {
    private final LinkedHashMap<String, Piece> table = new LinkedHashMap<>();
    public final Map<String, Piece> pieces = Collections.unmodifiableMap(table);

    public static class Piece {
        public final String name;
        public final List<String> dims;
        public final QuasiAffine expr;

        public Piece(String name_, List<String> dims_, QuasiAffine expr_) {
            name = name_;
            dims = List.copyOf(dims_);
            expr = expr_;
        }

        public Piece withExpr(QuasiAffine expr_) {
            return new Piece(name, dims, expr_);
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof Piece other && name.equals(other.name) && dims.equals(other.dims) && expr.equals(other.expr);
        }

        @Override
        public int hashCode() {
            return (name.hashCode() * 31 + dims.hashCode()) * 31 + expr.hashCode();
        }

        @Override
        public String toString() {
            return name + "[" + String.join(", ", dims) + "] -> [(" + expr.toString(dims) + ")]";
        }
    }

    public UnionPwAff(Collection<Piece> pieces_) {
        for (Piece piece : pieces_) {
            if (table.containsKey(piece.name)) {
                throw new ToolkitFailure("overlapping pieces for " + piece.name);
            }
            table.put(piece.name, piece);
        }
    }

    public Piece get(String name) {
        return pieces.get(name);
    }

    public Set<String> names() {
        return pieces.keySet();
    }

    public List<Piece> pieceList() {
        return new ArrayList<>(pieces.values());
    }

    public UnionPwAff map(Function<Piece, QuasiAffine> function) {
        List<Piece> result = new ArrayList<>();
        for (var piece : pieces.values()) {
            result.add(piece.withExpr(function.apply(piece)));
        }
        return new UnionPwAff(result);
    }

    public UnionPwAff restrict(Collection<String> names) {
        List<Piece> result = new ArrayList<>();
        for (var piece : pieces.values()) {
            if (names.contains(piece.name)) {
                result.add(piece);
            }
        }
        return new UnionPwAff(result);
    }

    /**
     * Union of functions over disjoint statement sets.
     */
    public UnionPwAff union(UnionPwAff other) {
        List<Piece> result = new ArrayList<>(pieces.values());
        result.addAll(other.pieces.values());
        return new UnionPwAff(result);
    }

    /**
     * Pointwise sum; statements without a piece in {@code correction} are
     * unchanged.
     */
    public UnionPwAff add(UnionPwAff correction) {
        return map(piece -> {
            var extra = correction.get(piece.name);
            return extra == null ? piece.expr : piece.expr.add(extra.expr);
        });
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof UnionPwAff other && pieces.equals(other.pieces);
    }

    @Override
    public int hashCode() {
        return pieces.hashCode();
    }

    @Override
    public String toString() {
        List<String> parts = new ArrayList<>();
        for (var piece : pieces.values()) {
            parts.add(piece.toString());
        }
        return "{ " + String.join("; ", parts) + " }";
    }
}
