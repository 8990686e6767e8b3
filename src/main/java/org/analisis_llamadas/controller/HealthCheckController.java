package org.analisis_llamadas.controller;

import org.analisis_llamadas.config.AnalisisProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/salud")
public class HealthCheckController {

    @Autowired
    private AnalisisProperties properties;

    /**
     * Estado del servicio y formatos de archivo aceptados
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> salud() {
        Map<String, Object> salud = new LinkedHashMap<>();
        salud.put("estado", "SALUDABLE");
        salud.put("extensionesSoportadas", properties.getExtensiones());
        salud.put("maximoCategoriasCobertura", properties.getTopCategorias());
        salud.put("timestamp", System.currentTimeMillis());
        return ResponseEntity.ok(salud);
    }
}
