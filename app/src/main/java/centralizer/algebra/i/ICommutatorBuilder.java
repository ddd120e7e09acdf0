package centralizer.algebra.i;

import centralizer.domain.commutator.CommutatorSystem;

/**
 * Construye L, el P genérico y el ideal H de la condición {@code [L, P] = 0}.
 */
@FunctionalInterface
public interface ICommutatorBuilder {
    CommutatorSystem build(int orderL, int orderP, int degree);
}
