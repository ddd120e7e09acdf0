package centralizer.config;

import lombok.Builder;
import lombok.With;

/**
 * Parámetros de un estudio completo: construcción del conmutador, análisis de ramas y filtrado.
 *
 * @param orderL               Orden n del operador de referencia L.
 * @param orderP               Orden m del operador P buscado (m >= n).
 * @param degree               Grado d del ansatz polinómico de los coeficientes de L.
 * @param normalizeLeading     Fija {@code c_m = 1} para eliminar el factor de escala de P.
 * @param excludeTrivialPowers Fija a cero {@code c_k} para los múltiplos k de n por debajo de m
 *                             (los {@code P_k = L^(k/n)} conmutan trivialmente). Si es falso,
 *                             esos huecos sólo se sugieren como pistas.
 */
@Builder
@With
public record StudyConfig(
        int orderL,
        int orderP,
        int degree,
        boolean normalizeLeading,
        boolean excludeTrivialPowers
) {
    public static StudyConfig getTestingStudy() {
        return StudyConfig.builder()
                .orderL(2)
                .orderP(3)
                .degree(1)
                .normalizeLeading(true)
                .excludeTrivialPowers(true)
                .build();
    }
}
