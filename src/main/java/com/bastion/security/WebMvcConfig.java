package com.bastion.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Web MVC configuration.
 *
 * - Registers {@link IdentityInterceptor} on the REST API
 * - Serves the published blacklist directory under /public/blacklist/**
 */
@Configuration
public class WebMvcConfig implements WebMvcConfigurer {

    private static final Logger log = LoggerFactory.getLogger(WebMvcConfig.class);

    private final IdentityInterceptor identityInterceptor;
    private final Path exportBaseDir;

    @Autowired
    public WebMvcConfig(IdentityInterceptor identityInterceptor,
                        @Value("${bastion.export.base-dir:./public/blacklist}") String exportBaseDir) {
        this.identityInterceptor = identityInterceptor;
        this.exportBaseDir = Paths.get(exportBaseDir).toAbsolutePath().normalize();
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(identityInterceptor)
            .addPathPatterns("/api/**")
            .order(0);
    }

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        String location = exportBaseDir.toUri().toString();
        if (!location.endsWith("/")) {
            location = location + "/";
        }
        log.info("Serving blacklist files from {}", location);
        registry.addResourceHandler("/public/blacklist/**")
            .addResourceLocations(location)
            .setCachePeriod(0);
    }
}
