package org.analisis_llamadas.component.agregador;

import org.analisis_llamadas.model.DesgloseInstalador;
import org.analisis_llamadas.model.RutaCombinada;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class CalculadorDesgloseInstaladorTest {

    private final CalculadorDesgloseInstalador calculador = new CalculadorDesgloseInstalador();

    @Test
    void deberiaOrdenarPorAgenteYLuegoPorFrecuenciaDescendente() {
        // GIVEN
        List<RutaCombinada> rutas = Arrays.asList(
                RutaCombinada.crear("Red", "Lenta", null, "Zoe"),
                RutaCombinada.crear("Red", "Caida", null, "Ana"),
                RutaCombinada.crear("Red", "Lenta", null, "Ana"),
                RutaCombinada.crear("Red", "Lenta", null, "Ana"),
                RutaCombinada.crear("Red", "Lenta", null, "Sin asignar"));

        // WHEN
        List<DesgloseInstalador> desglose = calculador.calcular(rutas);

        // THEN
        assertThat(desglose)
                .extracting(DesgloseInstalador::getAgenteInstalador, DesgloseInstalador::getRutaCompleta,
                        DesgloseInstalador::getFrecuencia)
                .containsExactly(
                        tuple("Ana", "Red | Lenta", 2L),
                        tuple("Ana", "Red | Caida", 1L),
                        tuple("Zoe", "Red | Lenta", 1L));
        assertThat(desglose.get(2).getPorcentajeAgente()).isEqualTo(100.0);
    }

    @Test
    void deberiaDesempatarPorClavesDeGrupo() {
        List<RutaCombinada> rutas = Arrays.asList(
                RutaCombinada.crear("B", "x", null, "Ana"),
                RutaCombinada.crear("A", "x", null, "Ana"));

        List<DesgloseInstalador> desglose = calculador.calcular(rutas);

        assertThat(desglose).extracting(DesgloseInstalador::getRutaCompleta)
                .containsExactly("A | x", "B | x");
        assertThat(desglose).extracting(DesgloseInstalador::getPorcentajeAgente)
                .containsOnly(50.0);
    }

    @Test
    void deberiaDevolverListaVaciaSiTodasLasRutasEstanSinAsignar() {
        List<RutaCombinada> rutas = Collections.singletonList(
                RutaCombinada.crear("Red", null, "Lenta", "Sin asignar"));

        assertThat(calculador.calcular(rutas)).isEmpty();
        assertThat(calculador.calcular(Collections.<RutaCombinada>emptyList())).isEmpty();
    }
}
