package com.vitals.analytics.config;

import com.vitals.analytics.model.MetricType;
import org.springframework.context.annotation.Configuration;
import org.springframework.format.FormatterRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {
  @Override
  public void addFormatters(FormatterRegistry registry) {
    // path segments use the wire name, e.g. /thresholds/{id}/heart_rate
    registry.addConverter(String.class, MetricType.class, MetricType::fromWire);
  }
}
