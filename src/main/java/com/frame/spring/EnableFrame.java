package com.frame.spring;

import com.frame.adapter.spring.FrameAutoConfiguration;
import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

/**
 * Enable the frame pipeline in a Spring Boot application.
 * 
 * Usage:
 * <pre>
 * &#64;SpringBootApplication
 * &#64;EnableFrame
 * public class MyApplication {
 *     public static void main(String[] args) {
 *         SpringApplication.run(MyApplication.class, args);
 *     }
 * }
 * </pre>
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Import(FrameAutoConfiguration.class)
public @interface EnableFrame {
}
