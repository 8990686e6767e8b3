package org.analisis_llamadas.component.identificador;

import lombok.extern.slf4j.Slf4j;
import org.analisis_llamadas.model.TablaDatos;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Lista ordenada de estrategias. Devuelve el resultado de la primera que
 * identifica una columna.
 */
@Slf4j
public class CadenaIdentificacion {

    private final String concepto;

    private final List<EstrategiaIdentificacion> estrategias;

    public CadenaIdentificacion(String concepto, EstrategiaIdentificacion... estrategias) {
        this.concepto = concepto;
        this.estrategias = Collections.unmodifiableList(new ArrayList<>(Arrays.asList(estrategias)));
    }

    public Optional<String> identificar(TablaDatos tabla) {
        for (EstrategiaIdentificacion estrategia : estrategias) {
            Optional<String> columna = estrategia.identificar(tabla);
            if (columna.isPresent()) {
                log.info("Columna de {} identificada en {}: '{}' (estrategia {})",
                        concepto, tabla.getNombre(), columna.get(), estrategia.getNombre());
                return columna;
            }
        }

        log.warn("No se pudo identificar una columna de {} en {}", concepto, tabla.getNombre());
        return Optional.empty();
    }
}
