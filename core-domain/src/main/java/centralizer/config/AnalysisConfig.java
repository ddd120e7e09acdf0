package centralizer.config;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Salvaguardas del analizador de ramas.
 * <p>
 * La búsqueda termina siempre (cada división fija o decide una variable), así que estos
 * límites sólo saltan ante un fallo de implementación o un problema demasiado grande.
 */
@Value
@Builder
@With
public class AnalysisConfig {

    /**
     * Profundidad máxima del árbol de casos.
     */
    @Builder.Default
    int maxDepth = 512;

    /**
     * Número máximo de nodos procesados (consistentes o no).
     */
    @Builder.Default
    int maxNodes = 200_000;

    public static AnalysisConfig defaults() {
        return AnalysisConfig.builder().build();
    }
}
