package com.gnovoa.matchsim.config;

import com.gnovoa.matchsim.model.TeamSide;
import com.gnovoa.matchsim.trace.AiTraceType;
import org.springframework.context.annotation.Configuration;
import org.springframework.format.FormatterRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/** Query parameters use the same lower-case wire names as JSON bodies ({@code ?team=home}). */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    @Override
    public void addFormatters(FormatterRegistry registry) {
        registry.addConverter(String.class, TeamSide.class, TeamSide::fromWire);
        registry.addConverter(String.class, AiTraceType.class, AiTraceType::fromWire);
    }
}
