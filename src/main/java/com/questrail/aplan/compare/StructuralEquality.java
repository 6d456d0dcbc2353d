package com.questrail.aplan.compare;

import com.questrail.aplan.model.AplComplex;
import com.questrail.aplan.model.AplMatrix;
import com.questrail.aplan.model.AplNamespace;
import com.questrail.aplan.model.AplNumber;
import com.questrail.aplan.model.AplText;
import com.questrail.aplan.model.AplValue;
import com.questrail.aplan.model.AplVector;

import java.util.List;
import java.util.Map;

/**
 * StructuralEquality
 * ============================================================================
 * Deep comparison of two {@link AplValue} trees, used to verify that
 * decode → encode → decode preserves meaning.
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li>Zilde equals itself and any empty vector.</li>
 *   <li>Numbers compare with {@code ==}, except that two NaNs are equal.</li>
 *   <li>Complex numbers compare component-wise under the same rule.</li>
 *   <li>Matrices compare shape, then cells in order.</li>
 *   <li>Namespaces compare as unordered key sets with equal values per key.</li>
 *   <li>Any other pair of different variants is unequal.</li>
 * </ul>
 *
 * <p>This is deliberately not {@link Object#equals(Object)}: record equality
 * distinguishes zilde from an empty vector and namespace entry order is
 * irrelevant here. It is not suitable for hashing or ordering.</p>
 */
public final class StructuralEquality
{
    private StructuralEquality() {}

    public static boolean equal(AplValue a, AplValue b) {
        if (a == b) {
            return true;
        }
        if (a == null || b == null) {
            return false;
        }

        if (isEmptyVectorLike(a) && isEmptyVectorLike(b)) {
            return true;
        }
        if (a.kind() != b.kind()) {
            return false;
        }

        return switch (a.kind()) {
            case NUMBER -> numbersEqual(((AplNumber) a).value(), ((AplNumber) b).value());
            case COMPLEX -> complexEqual((AplComplex) a, (AplComplex) b);
            case TEXT -> ((AplText) a).value().equals(((AplText) b).value());
            case VECTOR -> listsEqual(((AplVector) a).elements(), ((AplVector) b).elements());
            case MATRIX -> matricesEqual((AplMatrix) a, (AplMatrix) b);
            case NAMESPACE -> namespacesEqual((AplNamespace) a, (AplNamespace) b);
            // Both zilde was handled above.
            case ZILDE -> true;
        };
    }

    private static boolean isEmptyVectorLike(AplValue value) {
        return switch (value.kind()) {
            case ZILDE -> true;
            case VECTOR -> ((AplVector) value).isEmpty();
            default -> false;
        };
    }

    private static boolean numbersEqual(double x, double y) {
        if (Double.isNaN(x) && Double.isNaN(y)) {
            return true;
        }
        return x == y;
    }

    private static boolean complexEqual(AplComplex a, AplComplex b) {
        return numbersEqual(a.re(), b.re()) && numbersEqual(a.im(), b.im());
    }

    private static boolean matricesEqual(AplMatrix a, AplMatrix b) {
        return a.shape().equals(b.shape()) && listsEqual(a.cells(), b.cells());
    }

    private static boolean namespacesEqual(AplNamespace a, AplNamespace b) {
        Map<String, AplValue> left = a.entries();
        Map<String, AplValue> right = b.entries();
        if (left.size() != right.size()) {
            return false;
        }
        for (Map.Entry<String, AplValue> entry : left.entrySet()) {
            AplValue other = right.get(entry.getKey());
            if (other == null || !equal(entry.getValue(), other)) {
                return false;
            }
        }
        return true;
    }

    private static boolean listsEqual(List<AplValue> a, List<AplValue> b) {
        if (a.size() != b.size()) {
            return false;
        }
        for (int i = 0; i < a.size(); i++) {
            if (!equal(a.get(i), b.get(i))) {
                return false;
            }
        }
        return true;
    }
}
