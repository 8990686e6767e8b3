package org.analisis_llamadas.component.identificador;

import lombok.extern.slf4j.Slf4j;
import org.analisis_llamadas.model.TablaDatos;
import org.analisis_llamadas.utils.NormalizadorColumnas;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Busca, en orden, cada nombre objetivo con coincidencia flexible
 * (normalizada, exacta o por contención). Gana la primera columna del
 * primer objetivo que coincide.
 */
@Slf4j
public class EstrategiaSinonimos implements EstrategiaIdentificacion {

    private final List<String> objetivos;

    public EstrategiaSinonimos(List<String> objetivos) {
        this.objetivos = new ArrayList<>(objetivos);
    }

    @Override
    public Optional<String> identificar(TablaDatos tabla) {
        for (String objetivo : objetivos) {
            List<String> coincidencias = NormalizadorColumnas.buscarColumnasCoincidentes(tabla.getColumnas(), objetivo);
            if (!coincidencias.isEmpty()) {
                log.debug("Columna '{}' coincide con '{}'", coincidencias.get(0), objetivo);
                return Optional.of(coincidencias.get(0));
            }
        }
        return Optional.empty();
    }

    @Override
    public String getNombre() {
        return "SINONIMOS";
    }
}
