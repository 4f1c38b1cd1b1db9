package com.botflow.botflow_backend.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;
import org.springframework.web.filter.CorsFilter;

import java.util.Arrays;
import java.util.List;

/**
 * The flow editor and the embeddable chat widget are served from other origins. The editor
 * routes ({@code /api/flows}, {@code /api/bots}) accept the editor origins with credentials and
 * the {@code X-User-Id} header. The chat route accepts POSTs from the widget origins, which
 * default to any site embedding a bot.
 */
@Configuration
public class CorsConfig {

    @Value("${app.cors.allowed-origins:http://localhost:3000}")
    private String editorOrigins;

    @Value("${app.cors.widget-origins:*}")
    private String widgetOrigins;

    @Bean
    public CorsFilter corsFilter() {
        return new CorsFilter(corsConfigurationSource());
    }

    UrlBasedCorsConfigurationSource corsConfigurationSource() {
        CorsConfiguration editor = new CorsConfiguration();
        originsOf(editorOrigins).forEach(editor::addAllowedOriginPattern);
        editor.setAllowedMethods(List.of("GET", "POST", "PUT", "PATCH", "OPTIONS"));
        editor.setAllowedHeaders(List.of("Content-Type", "X-User-Id"));
        editor.setAllowCredentials(true);

        CorsConfiguration widget = new CorsConfiguration();
        originsOf(widgetOrigins).forEach(widget::addAllowedOriginPattern);
        widget.setAllowedMethods(List.of("POST", "OPTIONS"));
        widget.setAllowedHeaders(List.of("Content-Type"));

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/api/flows/**", editor);
        source.registerCorsConfiguration("/api/bots/**", editor);
        source.registerCorsConfiguration("/api/chat/**", widget);
        return source;
    }

    private static List<String> originsOf(String property) {
        return Arrays.stream(property.split("\\s*,\\s*"))
                .filter(origin -> !origin.isBlank())
                .toList();
    }
}
