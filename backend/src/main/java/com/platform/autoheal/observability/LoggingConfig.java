package com.platform.autoheal.observability;

import ch.qos.logback.classic.LoggerContext;
import com.platform.autoheal.model.WorkloadRef;
import jakarta.annotation.PostConstruct;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Logging configuration: correlation ids for API calls and cycle context for healing runs.
 */
@Slf4j
@Configuration
public class LoggingConfig {

    public static final String MDC_CORRELATION_ID = "correlationId";
    public static final String MDC_CYCLE_ID = "cycleId";
    public static final String MDC_WORKLOAD = "workload";

    @Value("${spring.application.name:autoheal-control-plane}")
    private String applicationName;

    @PostConstruct
    public void init() {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        context.putProperty("application", applicationName);

        log.info("Logging configuration initialized for application: {}", applicationName);
    }

    /**
     * Filter to add correlation ID to all requests.
     */
    @Bean
    public CorrelationIdFilter correlationIdFilter() {
        return new CorrelationIdFilter();
    }

    public static class CorrelationIdFilter extends OncePerRequestFilter {

        private static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

        @Override
        protected void doFilterInternal(
                HttpServletRequest request,
                HttpServletResponse response,
                FilterChain filterChain) throws ServletException, IOException {

            try {
                String correlationId = request.getHeader(CORRELATION_ID_HEADER);
                if (correlationId == null || correlationId.isBlank()) {
                    correlationId = UUID.randomUUID().toString();
                }

                MDC.put(MDC_CORRELATION_ID, correlationId);
                response.setHeader(CORRELATION_ID_HEADER, correlationId);

                filterChain.doFilter(request, response);

            } finally {
                MDC.remove(MDC_CORRELATION_ID);
            }
        }
    }

    /**
     * Set cycle context in MDC for the duration of one healing cycle.
     */
    public static String setCycleContext(WorkloadRef workload) {
        String cycleId = UUID.randomUUID().toString().substring(0, 8);
        MDC.put(MDC_CYCLE_ID, cycleId);
        MDC.put(MDC_WORKLOAD, workload.toString());
        return cycleId;
    }

    public static void clearCycleContext() {
        MDC.remove(MDC_CYCLE_ID);
        MDC.remove(MDC_WORKLOAD);
    }
}
