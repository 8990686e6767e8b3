package org.analisis_llamadas.component.identificador;

import org.analisis_llamadas.model.TablaDatos;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.analisis_llamadas.DatosPrueba.fila;
import static org.analisis_llamadas.DatosPrueba.tabla;
import static org.assertj.core.api.Assertions.assertThat;

class IdentificadorColumnasTest {

    private final IdentificadorColumnas identificador = new IdentificadorColumnas();

    // =============== CATEGORÍA ===============

    @Test
    void deberiaPreferirCategoriaGeneralSobreSinonimos() {
        TablaDatos datos = tabla("t.xlsx", Arrays.asList("motivo", "categoria_general"), fila("x", "A"));

        assertThat(identificador.identificarColumnaCategoria(datos)).contains("categoria_general");
    }

    @Test
    void deberiaEncontrarSinonimoConAcentosYEspacios() {
        TablaDatos datos = tabla("t.xlsx", Arrays.asList("ID", "Categoría Principal"), fila(1L, "Facturación"));

        assertThat(identificador.identificarColumnaCategoria(datos)).contains("Categoría Principal");
    }

    @Test
    void deberiaUsarPrimeraColumnaTextualComoUltimoRecurso() {
        TablaDatos datos = tabla("t.xlsx", Arrays.asList("id_cliente", "fecha_alta", "importe", "comentario"),
                fila(10L, "2025-01-01", "12.5", "Sin señal"));

        assertThat(identificador.identificarColumnaCategoria(datos)).contains("comentario");
    }

    @Test
    void deberiaDevolverVacioSiNingunaColumnaEsCategoria() {
        TablaDatos datos = tabla("t.xlsx", Arrays.asList("id_llamada", "duracion_segundos"), fila(1L, 30L));

        assertThat(identificador.identificarColumnaCategoria(datos)).isEmpty();
    }

    // =============== FECHA ===============

    @Test
    void deberiaEncontrarFechaPorNombreExactoSinDistinguirMayusculas() {
        TablaDatos datos = tabla("t.xlsx", Arrays.asList("categoria_general", "Fecha_Llamada"), fila("A", "x"));

        assertThat(identificador.identificarColumnaFecha(datos)).contains("Fecha_Llamada");
    }

    @Test
    void deberiaEncontrarFechaPorPalabraClave() {
        TablaDatos datos = tabla("t.xlsx", Arrays.asList("categoria_general", "Día de atención"), fila("A", "x"));

        assertThat(identificador.identificarColumnaFecha(datos)).contains("Día de atención");
    }

    @Test
    void deberiaEncontrarFechaPorPatronEnPrimerValor() {
        TablaDatos datos = tabla("t.xlsx", Arrays.asList("origen", "registro"),
                fila("web", null),
                fila("telefono", "2025-01-02 10:00:00"));

        assertThat(identificador.identificarColumnaFecha(datos)).contains("registro");
    }

    @Test
    void deberiaDevolverVacioSinColumnaDeFecha() {
        TablaDatos datos = tabla("t.xlsx", Arrays.asList("categoria_general"), fila("A"));

        assertThat(identificador.identificarColumnaFecha(datos)).isEmpty();
    }

    // =============== INSTALADOR ===============

    @Test
    void deberiaEncontrarInstaladorPorSinonimo() {
        TablaDatos datos = tabla("t.xlsx", Arrays.asList("categoria_general", "Técnico Asignado"), fila("A", "Ana"));

        assertThat(identificador.identificarColumnaInstalador(datos)).contains("Técnico Asignado");
    }

    @Test
    void deberiaDevolverVacioSinColumnaDeInstalador() {
        TablaDatos datos = tabla("t.xlsx", Arrays.asList("categoria_general", "categoria_especifica"), fila("A", "B"));

        assertThat(identificador.identificarColumnaInstalador(datos)).isEmpty();
    }
}
