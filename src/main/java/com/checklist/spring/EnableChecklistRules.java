package com.checklist.spring;

import com.checklist.adapter.spring.RulesAutoConfiguration;
import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

/**
 * Enable the checklist rule engine in a Spring Boot application.
 *
 * Usage:
 * <pre>
 * &#64;SpringBootApplication
 * &#64;EnableChecklistRules
 * public class FormBuilderApplication {
 *     public static void main(String[] args) {
 *         SpringApplication.run(FormBuilderApplication.class, args);
 *     }
 * }
 * </pre>
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Import(RulesAutoConfiguration.class)
public @interface EnableChecklistRules {
}
