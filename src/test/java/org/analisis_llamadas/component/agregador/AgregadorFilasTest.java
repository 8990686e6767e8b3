package org.analisis_llamadas.component.agregador;

import org.analisis_llamadas.component.identificador.IdentificadorColumnas;
import org.analisis_llamadas.component.lector.LectorExcel;
import org.analisis_llamadas.component.parser.FechaParser;
import org.analisis_llamadas.domain.ClavesAnalisis;
import org.analisis_llamadas.dto.FiltroFechasDTO;
import org.analisis_llamadas.enums.EstadoFiltroFecha;
import org.analisis_llamadas.model.DesgloseInstalador;
import org.analisis_llamadas.model.ResultadoArchivo;
import org.analisis_llamadas.model.RutaCombinada;
import org.analisis_llamadas.model.TablaDatos;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.analisis_llamadas.DatosPrueba.fila;
import static org.analisis_llamadas.DatosPrueba.tabla;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;
import static org.assertj.core.api.Assertions.tuple;
import static org.assertj.core.api.Assertions.within;

class AgregadorFilasTest {

    private static final List<String> COLUMNAS_RUTA =
            Arrays.asList("categoria_general", "categoria_especifica", "subtipo_categoria");

    @TempDir
    Path directorio;

    private AgregadorFilas agregador;

    @BeforeEach
    void setUp() {
        IdentificadorColumnas identificador = new IdentificadorColumnas();
        agregador = new AgregadorFilas(new LectorExcel(), identificador,
                new FiltradorFechas(identificador, new FechaParser()),
                new ConstructorRutas(), new CalculadorDesgloseInstalador());
    }

    @Test
    void noDeberiaSepararCategoriasPorComas() {
        TablaDatos datos = tabla("t.xlsx", Arrays.asList("categoria_general"),
                fila("Billing, Support"), fila("Billing"), fila(" Billing, Support "));

        ResultadoArchivo resultado = agregador.analizarTabla(datos, FiltroFechasDTO.sinFiltro());

        assertThat(resultado.getFrecuenciasGenerales().comoMapa())
                .containsExactly(entry("Billing, Support", 2L), entry("Billing", 1L));
        assertThat(resultado.getFilasProcesadas()).isEqualTo(3L);
    }

    @Test
    void deberiaConstruirRutaSinDesgloseCuandoNoHayColumnaDeInstalador() {
        // GIVEN
        TablaDatos datos = tabla("t.xlsx", COLUMNAS_RUTA, fila("Red", "Slow", null));

        // WHEN
        ResultadoArchivo resultado = agregador.analizarTabla(datos, FiltroFechasDTO.sinFiltro());

        // THEN
        assertThat(resultado.getAnalisisDetallado().getFrecuencias(ClavesAnalisis.CATEGORIA_COMBINADA).get().comoMapa())
                .containsExactly(entry("Red | Slow", 1L));
        List<RutaCombinada> detalle = resultado.getAnalisisDetallado()
                .getRegistros(ClavesAnalisis.CATEGORIA_COMBINADA_DETALLE, RutaCombinada.class);
        assertThat(detalle).hasSize(1);
        assertThat(detalle.get(0).getAgenteInstalador()).isEqualTo("Sin asignar");
        assertThat(resultado.getAnalisisDetallado().contiene(ClavesAnalisis.AGENTE_INSTALADOR_DETALLE)).isFalse();
    }

    @Test
    void deberiaRegistrarSoloRutasConMasDeUnaParte() {
        TablaDatos datos = tabla("t.xlsx", COLUMNAS_RUTA,
                fila("A", null, null),
                fila("A", null, "S"),
                fila(null, "X", "Y"));

        ResultadoArchivo resultado = agregador.analizarTabla(datos, FiltroFechasDTO.sinFiltro());

        assertThat(resultado.getAnalisisDetallado().getFrecuencias(ClavesAnalisis.CATEGORIA_COMBINADA).get().comoMapa())
                .containsExactly(entry("A | S", 1L));
        assertThat(resultado.getFilasProcesadas()).isEqualTo(3L);
    }

    @Test
    void deberiaTomarPrimerValorPresenteEntreColumnasEspecificas() {
        TablaDatos datos = tabla("t.xlsx",
                Arrays.asList("categoria_general", "categoria_especifica_1", "categoria_especifica_2"),
                fila("A", null, "E2"),
                fila("A", "E1", "E2"));

        ResultadoArchivo resultado = agregador.analizarTabla(datos, FiltroFechasDTO.sinFiltro());

        assertThat(resultado.getAnalisisDetallado().getFrecuencias(ClavesAnalisis.CATEGORIA_COMBINADA).get().comoMapa())
                .containsExactly(entry("A | E2", 1L), entry("A | E1", 1L));
    }

    @Test
    void deberiaContarColumnasEspecificasPorSuNombreOriginal() {
        TablaDatos datos = tabla("t.xlsx", Arrays.asList("categoria_general", "Subtipo", "motivo_vacio_tipo"),
                fila("A", "S1", null),
                fila("B", "S1", null));

        ResultadoArchivo resultado = agregador.analizarTabla(datos, FiltroFechasDTO.sinFiltro());

        assertThat(resultado.getAnalisisDetallado().getFrecuencias("Subtipo").get().comoMapa())
                .containsExactly(entry("S1", 2L));
        // columnas sin valores no generan entrada
        assertThat(resultado.getAnalisisDetallado().contiene("motivo_vacio_tipo")).isFalse();
    }

    @Test
    void deberiaCalcularDesglosePorInstaladorExcluyendoSinAsignar() {
        // GIVEN
        TablaDatos datos = tabla("t.xlsx",
                Arrays.asList("categoria_general", "categoria_especifica", "agente_instalador"),
                fila("A", "x", "Ana"),
                fila("A", "y", "Ana"),
                fila("A", "x", "Ana"),
                fila("B", "z", "Beto"),
                fila("A", "x", null));

        // WHEN
        ResultadoArchivo resultado = agregador.analizarTabla(datos, FiltroFechasDTO.sinFiltro());
        List<DesgloseInstalador> desglose = resultado.getAnalisisDetallado()
                .getRegistros(ClavesAnalisis.AGENTE_INSTALADOR_DETALLE, DesgloseInstalador.class);

        // THEN
        assertThat(desglose).extracting(DesgloseInstalador::getAgenteInstalador, DesgloseInstalador::getRutaCompleta,
                        DesgloseInstalador::getFrecuencia)
                .containsExactly(
                        tuple("Ana", "A | x", 2L),
                        tuple("Ana", "A | y", 1L),
                        tuple("Beto", "B | z", 1L));

        double sumaAna = 0;
        for (DesgloseInstalador registro : desglose) {
            if ("Ana".equals(registro.getAgenteInstalador())) {
                sumaAna += registro.getPorcentajeAgente();
            }
        }
        assertThat(sumaAna).isCloseTo(100.0, within(1e-9));
        assertThat(desglose.get(2).getPorcentajeAgente()).isEqualTo(100.0);
    }

    @Test
    void deberiaInformarFilasSinCategoriasCuandoNoHayColumnaDeCategoria() {
        List<Object[]> filas = new ArrayList<>();
        for (long i = 0; i < 100; i++) {
            filas.add(fila(i, 30L + i));
        }
        TablaDatos datos = tabla("t.xlsx", Arrays.asList("id_llamada", "duracion_segundos"),
                filas.toArray(new Object[0][]));

        ResultadoArchivo resultado = agregador.analizarTabla(datos, FiltroFechasDTO.sinFiltro());

        assertThat(resultado.getFrecuenciasGenerales().estaVacio()).isTrue();
        assertThat(resultado.getFilasProcesadas()).isEqualTo(100L);
        assertThat(resultado.getAnalisisDetallado().estaVacio()).isTrue();
        assertThat(resultado.isConError()).isFalse();
    }

    // =============== FILTRO DE FECHAS ===============

    @Test
    void deberiaFiltrarPorRangoInclusivoYDescartarFilasSinFecha() {
        // GIVEN
        TablaDatos datos = tabla("t.xlsx", Arrays.asList("categoria_general", "fecha"),
                fila("antes", "2025-01-09 23:59:59"),
                fila("inicio", LocalDateTime.of(2025, 1, 10, 0, 0)),
                fila("fin", "2025-01-20"),
                fila("sin_fecha", "pendiente"),
                fila("despues", "2025-01-20 00:00:01"));
        FiltroFechasDTO filtro = FiltroFechasDTO.desdeTexto("2025-01-10", "2025-01-20", false);

        // WHEN
        ResultadoArchivo resultado = agregador.analizarTabla(datos, filtro);

        // THEN
        assertThat(resultado.getEstadoFiltro()).isEqualTo(EstadoFiltroFecha.APLICADO);
        assertThat(resultado.getFilasProcesadas()).isEqualTo(2L);
        assertThat(resultado.getFrecuenciasGenerales().getClaves()).containsExactly("inicio", "fin");
    }

    @Test
    void deberiaProcesarSinFiltrarCuandoNoHayColumnaDeFecha() {
        TablaDatos datos = tabla("t.xlsx", Arrays.asList("categoria_general"), fila("A"), fila("B"));
        FiltroFechasDTO filtro = FiltroFechasDTO.desdeTexto("2025-01-10", null, false);

        ResultadoArchivo resultado = agregador.analizarTabla(datos, filtro);

        assertThat(resultado.getEstadoFiltro()).isEqualTo(EstadoFiltroFecha.SIN_COLUMNA_FECHA);
        assertThat(resultado.getFilasProcesadas()).isEqualTo(2L);
    }

    @Test
    void deberiaDevolverResultadoVacioSiElFiltroDescartaTodo() {
        TablaDatos datos = tabla("t.xlsx", Arrays.asList("categoria_general", "fecha"), fila("A", "2024-12-31"));
        FiltroFechasDTO filtro = FiltroFechasDTO.desdeTexto("2025-01-01", null, false);

        ResultadoArchivo resultado = agregador.analizarTabla(datos, filtro);

        assertThat(resultado.getFilasProcesadas()).isZero();
        assertThat(resultado.getFrecuenciasGenerales().estaVacio()).isTrue();
    }

    // =============== ERRORES ===============

    @Test
    void deberiaAislarErrorDeArchivoYDevolverResultadoVacio() {
        ResultadoArchivo resultado = agregador.analizarArchivo(directorio.resolve("no_existe.xlsx"),
                FiltroFechasDTO.sinFiltro());

        assertThat(resultado.isConError()).isTrue();
        assertThat(resultado.getFilasProcesadas()).isZero();
        assertThat(resultado.getFrecuenciasGenerales().estaVacio()).isTrue();
    }
}
