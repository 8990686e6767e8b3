package org.analisis_llamadas.component.lector;

import org.analisis_llamadas.DatosPrueba;
import org.analisis_llamadas.enums.EtapaAnalisis;
import org.analisis_llamadas.exception.AnalisisException;
import org.analisis_llamadas.model.TablaDatos;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.analisis_llamadas.DatosPrueba.fila;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LectorExcelTest {

    @TempDir
    Path directorio;

    private final LectorExcel lector = new LectorExcel();

    @Test
    void deberiaLeerPrimeraHojaConTiposDeCelda() throws Exception {
        // GIVEN
        LocalDateTime fecha = LocalDateTime.of(2025, 1, 15, 10, 30, 0);
        Path archivo = DatosPrueba.escribirXlsx(directorio.resolve("llamadas.xlsx"),
                Arrays.asList("categoria_general", null, "categoria_general", "fecha"),
                fila("Facturación", 7, 2.5, fecha),
                fila("   ", true, null, null),
                fila("  ", null, null, null));

        // WHEN
        TablaDatos tabla = lector.leer(archivo);

        // THEN
        assertThat(tabla.getNombre()).isEqualTo("llamadas.xlsx");
        assertThat(tabla.getColumnas()).containsExactly("categoria_general", "Unnamed: 1", "categoria_general.1", "fecha");
        assertThat(tabla.getNumeroFilas()).isEqualTo(2);
        assertThat(tabla.getValor(0, "categoria_general")).isEqualTo("Facturación");
        assertThat(tabla.getValor(0, "Unnamed: 1")).isEqualTo(7L);
        assertThat(tabla.getValor(0, "categoria_general.1")).isEqualTo(2.5);
        assertThat(tabla.getValor(0, "fecha")).isEqualTo(fecha);
        assertThat(tabla.getValor(1, "categoria_general")).isNull();
        assertThat(tabla.getValor(1, "Unnamed: 1")).isEqualTo(true);
    }

    @Test
    void deberiaLeerElMismoLibroDesdeVariosHilos() throws Exception {
        // GIVEN
        Path archivo = DatosPrueba.escribirXlsx(directorio.resolve("concurrente.xlsx"),
                Arrays.asList("categoria_general", "agente_instalador", "fecha"),
                fila("Red", "Ana", LocalDateTime.of(2025, 1, 15, 10, 30, 0)));
        ExecutorService pool = Executors.newFixedThreadPool(4);

        // WHEN
        List<Future<TablaDatos>> lecturas = new ArrayList<>();
        try {
            for (int i = 0; i < 8; i++) {
                lecturas.add(pool.submit(() -> lector.leer(archivo)));
            }

            // THEN
            for (Future<TablaDatos> lectura : lecturas) {
                assertThat(lectura.get(30, TimeUnit.SECONDS).getColumnas())
                        .containsExactly("categoria_general", "agente_instalador", "fecha");
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void deberiaLeerCsvConPuntoYComaYBom() throws Exception {
        Path archivo = directorio.resolve("export.csv");
        String contenido = "\uFEFFcategoria_general;agente_instalador\n"
                + "Red;Ana\n"
                + "\n"
                + "\"Billing, Support\";\n";
        Files.write(archivo, contenido.getBytes(StandardCharsets.UTF_8));

        TablaDatos tabla = lector.leer(archivo);

        assertThat(tabla.getColumnas()).containsExactly("categoria_general", "agente_instalador");
        assertThat(tabla.getValoresColumna("categoria_general")).containsExactly("Red", "Billing, Support");
        assertThat(tabla.getValoresColumna("agente_instalador")).containsExactly("Ana", null);
    }

    @Test
    void deberiaFallarEnEtapaDeLecturaSiElArchivoNoExiste() {
        Path inexistente = directorio.resolve("no_existe.xlsx");

        assertThatThrownBy(() -> lector.leer(inexistente))
                .isInstanceOf(AnalisisException.class)
                .satisfies(e -> {
                    AnalisisException ae = (AnalisisException) e;
                    assertThat(ae.getEtapa()).isEqualTo(EtapaAnalisis.LECTURA);
                    assertThat(ae.getArchivo()).isEqualTo("no_existe.xlsx");
                });
    }

    @Test
    void deberiaFallarConArchivoQueNoEsExcel() throws Exception {
        Path archivo = directorio.resolve("roto.xlsx");
        Files.write(archivo, "esto no es un libro".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> lector.leer(archivo)).isInstanceOf(AnalisisException.class);
    }

    @Test
    void deberiaNombrarColumnasVaciasYDuplicadas() {
        assertThat(lector.nombrarColumnas(Arrays.asList("motivo", "motivo", "motivo", "", null)))
                .containsExactly("motivo", "motivo.1", "motivo.2", "Unnamed: 3", "Unnamed: 4");
    }
}
