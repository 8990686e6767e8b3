package org.analisis_llamadas.component.agregador;

import lombok.extern.slf4j.Slf4j;
import org.analisis_llamadas.domain.ColumnasConocidas;
import org.analisis_llamadas.model.DesgloseInstalador;
import org.analisis_llamadas.model.RutaCombinada;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Agrupa las rutas por agente instalador y calcula el porcentaje de cada
 * ruta sobre el total de llamadas del propio agente.
 *
 * Las llamadas "Sin asignar" se excluyen. Orden: agente ascendente,
 * frecuencia descendente; los empates siguen el orden de las claves de grupo.
 */
@Slf4j
@Component
public class CalculadorDesgloseInstalador {

    private static final Comparator<List<String>> ORDEN_CLAVES = (a, b) -> {
        for (int i = 0; i < a.size(); i++) {
            int comparacion = a.get(i).compareTo(b.get(i));
            if (comparacion != 0) {
                return comparacion;
            }
        }
        return 0;
    };

    public List<DesgloseInstalador> calcular(List<RutaCombinada> rutas) {
        if (rutas == null || rutas.isEmpty()) {
            return Collections.emptyList();
        }

        // (agente, general, especifica, subtipo, ruta) -> frecuencia
        Map<List<String>, Long> grupos = new TreeMap<>(ORDEN_CLAVES);
        Map<String, Long> totalPorAgente = new HashMap<>();

        for (RutaCombinada ruta : rutas) {
            String agente = ruta.getAgenteInstalador() != null
                    ? ruta.getAgenteInstalador() : ColumnasConocidas.SIN_ASIGNAR;
            if (ColumnasConocidas.SIN_ASIGNAR.equals(agente)) {
                continue;
            }

            List<String> clave = Arrays.asList(agente,
                    valorOVacio(ruta.getCategoriaGeneral()),
                    valorOVacio(ruta.getCategoriaEspecifica()),
                    valorOVacio(ruta.getSubtipo()),
                    valorOVacio(ruta.getRutaCompleta()));
            grupos.merge(clave, 1L, Long::sum);
            totalPorAgente.merge(agente, 1L, Long::sum);
        }

        List<DesgloseInstalador> desglose = new ArrayList<>(grupos.size());
        for (Map.Entry<List<String>, Long> grupo : grupos.entrySet()) {
            List<String> clave = grupo.getKey();
            long frecuencia = grupo.getValue();
            long totalAgente = totalPorAgente.get(clave.get(0));

            desglose.add(DesgloseInstalador.builder()
                    .agenteInstalador(clave.get(0))
                    .categoriaGeneral(clave.get(1))
                    .categoriaEspecifica(clave.get(2))
                    .subtipo(clave.get(3))
                    .rutaCompleta(clave.get(4))
                    .frecuencia(frecuencia)
                    .porcentajeAgente(frecuencia * 100.0 / totalAgente)
                    .build());
        }

        // Estable: dentro de un agente y frecuencia se conserva el orden de las claves
        desglose.sort(Comparator.comparing(DesgloseInstalador::getAgenteInstalador)
                .thenComparing(Comparator.comparingLong(DesgloseInstalador::getFrecuencia).reversed()));

        log.debug("Desglose por instalador: {} registros para {} agentes", desglose.size(), totalPorAgente.size());
        return desglose;
    }

    private String valorOVacio(String valor) {
        return valor != null ? valor : "";
    }
}
