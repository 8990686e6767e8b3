package org.analisis_llamadas.component.identificador;

import org.analisis_llamadas.model.TablaDatos;
import org.analisis_llamadas.utils.RegexUtils;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Date;
import java.util.Optional;

/**
 * Primera columna cuyo primer valor no vacío es una fecha o contiene un
 * patrón de fecha reconocible.
 */
public class EstrategiaPatronFecha implements EstrategiaIdentificacion {

    @Override
    public Optional<String> identificar(TablaDatos tabla) {
        for (String columna : tabla.getColumnas()) {
            Object muestra = tabla.getPrimerValorNoNulo(columna);
            if (muestra == null) {
                continue;
            }
            if (muestra instanceof LocalDateTime || muestra instanceof LocalDate || muestra instanceof Date
                    || RegexUtils.contieneFecha(String.valueOf(muestra))) {
                return Optional.of(columna);
            }
        }
        return Optional.empty();
    }

    @Override
    public String getNombre() {
        return "PATRON_EN_VALORES";
    }
}
