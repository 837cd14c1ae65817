package polyopt.polyhedral.affine;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * A band's partial schedule: a named tuple of union piecewise functions, one
 * per band dimension.
 */
public class MultiUnionPwAff {
    public final String tupleId;
    public final List<String> params;
    public final List<UnionPwAff> dims;

    public MultiUnionPwAff(String tupleId_, List<String> params_, List<UnionPwAff> dims_) {
        tupleId = tupleId_;
        params = List.copyOf(params_);
        dims = List.copyOf(dims_);
    }

    public int size() {
        return dims.size();
    }

    public UnionPwAff get(int pos) {
        return dims.get(pos);
    }

    public Set<String> names() {
        return dims.get(0).names();
    }

    public MultiUnionPwAff withDims(List<UnionPwAff> dims_) {
        return new MultiUnionPwAff(tupleId, params, dims_);
    }

    public MultiUnionPwAff map(Function<UnionPwAff, UnionPwAff> function) {
        List<UnionPwAff> result = new ArrayList<>();
        for (UnionPwAff dim : dims) {
            result.add(function.apply(dim));
        }
        return withDims(result);
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof MultiUnionPwAff other && tupleId.equals(other.tupleId)
                && params.equals(other.params) && dims.equals(other.dims);
    }

    @Override
    public int hashCode() {
        return (tupleId.hashCode() * 31 + params.hashCode()) * 31 + dims.hashCode();
    }

    @Override
    public String toString() {
        List<String> parts = new ArrayList<>();
        for (UnionPwAff dim : dims) {
            parts.add(dim.toString());
        }
        return UnionSet.paramsPrefix(params) + tupleId + "[" + String.join(", ", parts) + "]";
    }
}
