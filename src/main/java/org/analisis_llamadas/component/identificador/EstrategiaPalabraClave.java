package org.analisis_llamadas.component.identificador;

import org.analisis_llamadas.model.TablaDatos;
import org.analisis_llamadas.utils.NormalizadorColumnas;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Primera columna cuyo nombre normalizado contiene alguna palabra clave.
 */
public class EstrategiaPalabraClave implements EstrategiaIdentificacion {

    private final List<String> palabrasClave;

    public EstrategiaPalabraClave(List<String> palabrasClave) {
        this.palabrasClave = new ArrayList<>(palabrasClave);
    }

    @Override
    public Optional<String> identificar(TablaDatos tabla) {
        for (String columna : tabla.getColumnas()) {
            if (NormalizadorColumnas.contienePalabraClave(columna, palabrasClave)) {
                return Optional.of(columna);
            }
        }
        return Optional.empty();
    }

    @Override
    public String getNombre() {
        return "PALABRA_CLAVE";
    }
}
