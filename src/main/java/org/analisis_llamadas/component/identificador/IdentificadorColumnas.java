package org.analisis_llamadas.component.identificador;

import lombok.extern.slf4j.Slf4j;
import org.analisis_llamadas.domain.ColumnasConocidas;
import org.analisis_llamadas.model.TablaDatos;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Identifica las columnas de categoría, fecha y agente instalador de una tabla
 * con encabezados heterogéneos.
 *
 * Orden de las heurísticas:
 * - Categoría: "categoria_general", sinónimos, palabra clave, primera columna de texto
 * - Fecha: nombre exacto conocido, palabra clave, patrón de fecha en el primer valor
 * - Instalador: sinónimos, palabra clave
 */
@Slf4j
@Component
public class IdentificadorColumnas {

    private final CadenaIdentificacion cadenaCategoria;
    private final CadenaIdentificacion cadenaFecha;
    private final CadenaIdentificacion cadenaInstalador;

    public IdentificadorColumnas() {
        List<String> objetivosCategoria = new ArrayList<>();
        objetivosCategoria.add(ColumnasConocidas.CATEGORIA_GENERAL);
        objetivosCategoria.addAll(ColumnasConocidas.SINONIMOS_CATEGORIA);

        this.cadenaCategoria = new CadenaIdentificacion("categoría",
                new EstrategiaSinonimos(objetivosCategoria),
                new EstrategiaPalabraClave(ColumnasConocidas.PALABRAS_CLAVE_CATEGORIA),
                new EstrategiaColumnaTextual(ColumnasConocidas.PREFIJOS_NO_CATEGORIA));

        this.cadenaFecha = new CadenaIdentificacion("fecha",
                new EstrategiaNombreExacto(ColumnasConocidas.NOMBRES_FECHA),
                new EstrategiaPalabraClave(ColumnasConocidas.PALABRAS_CLAVE_FECHA),
                new EstrategiaPatronFecha());

        this.cadenaInstalador = new CadenaIdentificacion("agente instalador",
                new EstrategiaSinonimos(ColumnasConocidas.SINONIMOS_INSTALADOR),
                new EstrategiaPalabraClave(ColumnasConocidas.PALABRAS_CLAVE_INSTALADOR));
    }

    public Optional<String> identificarColumnaCategoria(TablaDatos tabla) {
        return cadenaCategoria.identificar(tabla);
    }

    public Optional<String> identificarColumnaFecha(TablaDatos tabla) {
        return cadenaFecha.identificar(tabla);
    }

    public Optional<String> identificarColumnaInstalador(TablaDatos tabla) {
        return cadenaInstalador.identificar(tabla);
    }
}
