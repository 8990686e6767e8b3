package org.analisis_llamadas.enums;

import lombok.Getter;

@Getter
public enum EtapaAnalisis {
    VALIDACION("validación de parámetros"),
    LECTURA("lectura de archivo"),
    FILTRO_FECHAS("filtro de fechas"),
    IDENTIFICACION("identificación de columnas"),
    AGREGACION("agregación de filas"),
    REPORTE("generación de reporte");

    private final String descripcion;

    EtapaAnalisis(String descripcion) {
        this.descripcion = descripcion;
    }
}
