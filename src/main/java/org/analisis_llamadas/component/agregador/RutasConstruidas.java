package org.analisis_llamadas.component.agregador;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.analisis_llamadas.model.ContadorFrecuencias;
import org.analisis_llamadas.model.RutaCombinada;

import java.util.List;

@Getter
@AllArgsConstructor
public class RutasConstruidas {
    private final ContadorFrecuencias frecuencias;
    private final List<RutaCombinada> detalle;
}
