package centralizer.config;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Parámetros de nombrado y límites del constructor del conmutador.
 */
@Value
@Builder
@With
public class CommutatorConfig {

    /**
     * Prefijo de las incógnitas de los huecos de P ({@code c_0, c_1, ...}).
     */
    @Builder.Default
    String flagName = "c";

    /**
     * Prefijo de las incógnitas del ansatz polinómico de L ({@code b_i_j}).
     */
    @Builder.Default
    String ansatzName = "b";

    /**
     * Variable polinómica sobre la que actúa la derivación (x' = 1).
     */
    @Builder.Default
    String polynomialVariable = "x";

    /**
     * Símbolo con el que se muestran las potencias de la derivación ({@code z[i]}).
     */
    @Builder.Default
    String operatorSymbol = "z";

    /**
     * Máximo de incógnitas que puede registrar el anillo de coeficientes.
     */
    @Builder.Default
    int maxUnknowns = 10_000;

    public static CommutatorConfig defaults() {
        return CommutatorConfig.builder().build();
    }
}
