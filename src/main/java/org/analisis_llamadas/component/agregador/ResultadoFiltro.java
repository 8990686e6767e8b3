package org.analisis_llamadas.component.agregador;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.analisis_llamadas.enums.EstadoFiltroFecha;
import org.analisis_llamadas.model.TablaDatos;

@Getter
@AllArgsConstructor
public class ResultadoFiltro {
    private final TablaDatos tabla;
    private final EstadoFiltroFecha estado;
}
