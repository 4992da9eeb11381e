package com.sandy.aiot.vision.baseline.aspect;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

/**
 * Logs every baseline query with its body, the answer and the time it took. Bodies are cut at 2000 chars.
 */
@Aspect
@Component
@RequiredArgsConstructor
@Slf4j
public class ApiLoggingAspect {

    private static final int MAX_BODY_CHARS = 2000;

    private final ObjectMapper objectMapper;

    @Around("within(com.sandy.aiot.vision.baseline.controller.BaselineQueryController)")
    public Object logBaselineQuery(ProceedingJoinPoint pjp) throws Throwable {
        long start = System.currentTimeMillis();
        String endpoint = endpoint();
        Object[] args = pjp.getArgs();
        log.info("Baseline query {} body={}", endpoint, args.length == 0 ? "-" : toJson(args[0]));
        try {
            Object result = pjp.proceed();
            log.info("Baseline query {} answered in {}ms: {}", endpoint, System.currentTimeMillis() - start, toJson(result));
            return result;
        } catch (Throwable t) {
            log.warn("Baseline query {} failed in {}ms: {}({})", endpoint, System.currentTimeMillis() - start,
                    t.getClass().getSimpleName(), t.getMessage());
            throw t;
        }
    }

    private static String endpoint() {
        ServletRequestAttributes attrs = (ServletRequestAttributes) RequestContextHolder.getRequestAttributes();
        if (attrs == null) return "(no request)";
        HttpServletRequest request = attrs.getRequest();
        return request.getMethod() + " " + request.getRequestURI();
    }

    private String toJson(Object obj) {
        try {
            String s = objectMapper.writeValueAsString(obj);
            if (s.length() > MAX_BODY_CHARS) {
                return s.substring(0, MAX_BODY_CHARS) + "...(" + (s.length() - MAX_BODY_CHARS) + " more chars)";
            }
            return s;
        } catch (JsonProcessingException e) {
            return String.valueOf(obj);
        }
    }
}
