package org.analisis_llamadas.component.agregador;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.analisis_llamadas.component.identificador.IdentificadorColumnas;
import org.analisis_llamadas.component.parser.FechaParser;
import org.analisis_llamadas.dto.FiltroFechasDTO;
import org.analisis_llamadas.enums.EstadoFiltroFecha;
import org.analisis_llamadas.model.TablaDatos;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Filtra las filas de una tabla por el rango de fechas configurado.
 *
 * Las filas sin fecha reconocible se descartan cuando hay algún extremo activo.
 * Si la tabla no tiene columna de fecha identificable se devuelve completa y
 * el resultado lo indica con {@link EstadoFiltroFecha#SIN_COLUMNA_FECHA}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FiltradorFechas {

    private final IdentificadorColumnas identificadorColumnas;
    private final FechaParser fechaParser;

    public ResultadoFiltro aplicar(TablaDatos tabla, FiltroFechasDTO filtro) {
        if (filtro == null || !filtro.estaConfigurado()) {
            return new ResultadoFiltro(tabla, EstadoFiltroFecha.NO_CONFIGURADO);
        }

        Optional<String> columnaFecha = identificadorColumnas.identificarColumnaFecha(tabla);
        if (!columnaFecha.isPresent()) {
            log.warn("⚠️ {}: sin columna de fecha, se procesa sin filtrar ({} filas)",
                    tabla.getNombre(), tabla.getNumeroFilas());
            return new ResultadoFiltro(tabla, EstadoFiltroFecha.SIN_COLUMNA_FECHA);
        }

        String columna = columnaFecha.get();
        List<LocalDateTime> fechas = new ArrayList<>(tabla.getNumeroFilas());
        for (Object valor : tabla.getValoresColumna(columna)) {
            fechas.add(fechaParser.parsear(valor).orElse(null));
        }

        TablaDatos filtrada = tabla.filtrarFilas(fila -> filtro.contiene(fechas.get(fila)));

        log.info("Filtrado aplicado en {} por '{}': {} -> {} filas",
                tabla.getNombre(), columna, tabla.getNumeroFilas(), filtrada.getNumeroFilas());
        return new ResultadoFiltro(filtrada, EstadoFiltroFecha.APLICADO);
    }
}
