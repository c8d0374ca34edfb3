package com.example.taskboard.realtime.config;

import com.example.taskboard.shared.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.server.WebFilter;
import reactor.core.publisher.Mono;

import java.util.regex.Pattern;

/**
 * Request logging for the REST endpoints and the WebSocket upgrade. The handshake
 * credential travels in the query string and is masked before anything is logged.
 */
@Configuration
public class LoggingConfig {

    private static final Logger log = LoggerFactory.getLogger(LoggingConfig.class);

    @Bean
    public WebFilter loggingFilter(AppProperties appProperties) {
        Pattern credentialParam = Pattern.compile("(^|&)(" + Pattern.quote(appProperties.getRealtime().getTokenParam()) + ")=[^&]*");
        return (exchange, chain) -> {
            long startTime = System.currentTimeMillis();
            String path = exchange.getRequest().getURI().getPath();
            String method = exchange.getRequest().getMethod().name();

            if (log.isDebugEnabled()) {
                log.debug("Incoming request: {} {}{} from {}",
                    method,
                    path,
                    maskedQuery(exchange.getRequest().getURI().getRawQuery(), credentialParam),
                    exchange.getRequest().getRemoteAddress());
            }

            return chain.filter(exchange)
                .then(Mono.fromRunnable(() -> {
                    if (log.isDebugEnabled()) {
                        long duration = System.currentTimeMillis() - startTime;
                        log.debug("Outgoing response: {} {} - {} in {}ms",
                            method,
                            path,
                            exchange.getResponse().getStatusCode(),
                            duration);
                    }
                }));
        };
    }

    static String maskedQuery(String rawQuery, Pattern credentialParam) {
        if (rawQuery == null || rawQuery.isEmpty()) {
            return "";
        }
        return "?" + credentialParam.matcher(rawQuery).replaceAll("$1$2=***");
    }
}
