package centralizer.domain.commutator;

import centralizer.domain.ideal.Ideal;
import centralizer.domain.operator.DifferentialOperator;
import centralizer.domain.ring.PolynomialRing;
import centralizer.domain.ring.Variable;

import java.util.List;

/**
 * Resultado del constructor del conmutador: el par (L, P), la base casi conmutante usada para P
 * y el ideal H de condiciones algebraicas para que {@code [L, P] = 0}.
 *
 * @param ring                  Anillo de coeficientes, congelado tras la construcción.
 * @param reference             Operador de referencia L en forma normal.
 * @param candidate             Operador genérico {@code P = Σ c_k P_k}.
 * @param almostCommutingBasis  {@code P_0 .. P_m} con {@code P_k = (L^(k/n))_+}.
 * @param bracket               {@code [L, P]} antes de extraer ecuaciones.
 * @param ideal                 Ideal H de la conmutación.
 * @param flags                 Incógnitas {@code c_0 .. c_m} de los huecos de P.
 * @param ansatz                Incógnitas {@code b_i_j} del ansatz de L, fila a fila.
 * @param elapsedMillis         Tiempo de construcción (la parte cara del cálculo).
 */
public record CommutatorSystem(
        PolynomialRing ring,
        DifferentialOperator reference,
        DifferentialOperator candidate,
        List<DifferentialOperator> almostCommutingBasis,
        DifferentialOperator bracket,
        Ideal ideal,
        List<Variable> flags,
        List<List<Variable>> ansatz,
        long elapsedMillis
) {
    public CommutatorSystem {
        almostCommutingBasis = List.copyOf(almostCommutingBasis);
        flags = List.copyOf(flags);
        ansatz = ansatz.stream().map(List::copyOf).toList();
    }

    public int orderL() {
        return reference.order();
    }

    public int orderP() {
        return flags.size() - 1;
    }

    public Variable flag(int k) {
        return flags.get(k);
    }
}
