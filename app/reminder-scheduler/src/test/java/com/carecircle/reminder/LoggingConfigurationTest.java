/*
 * どこで: Reminder Scheduler のログ設定テスト
 * 何を: JSON encoder の各 provider のフィールド名と sweep 単位の MDC フィールドを検証する
 * なぜ: 設定変更で構造化ログのキー名や sweep 単位の追跡が欠落する回帰を防ぐため
 */
package com.carecircle.reminder;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.InputStream;
import java.util.HashMap;
import java.util.Map;
import javax.xml.parsers.DocumentBuilderFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

class LoggingConfigurationTest {

  private Element providers;

  @BeforeEach
  void loadEncoderProviders() throws Exception {
    final ClassPathResource resource = new ClassPathResource("logback-spring.xml");
    assertThat(resource.exists()).isTrue();
    final Document document;
    try (InputStream in = resource.getInputStream()) {
      document = DocumentBuilderFactory.newInstance().newDocumentBuilder().parse(in);
    }
    final Element encoder = (Element) document.getElementsByTagName("encoder").item(0);
    assertThat(encoder.getAttribute("class"))
        .isEqualTo("net.logstash.logback.encoder.LoggingEventCompositeJsonEncoder");
    providers = (Element) encoder.getElementsByTagName("providers").item(0);
  }

  @Test
  void providersUseSnakeCaseFieldNames() {
    final Map<String, String> fieldNames = new HashMap<>();
    final NodeList children = providers.getChildNodes();
    for (int i = 0; i < children.getLength(); i++) {
      final Node child = children.item(i);
      if (child instanceof Element provider) {
        final NodeList fieldName = provider.getElementsByTagName("fieldName");
        if (fieldName.getLength() > 0) {
          fieldNames.put(provider.getTagName(), fieldName.item(0).getTextContent().trim());
        }
      }
    }

    assertThat(fieldNames)
        .containsEntry("timestamp", "timestamp")
        .containsEntry("logLevel", "level")
        .containsEntry("loggerName", "logger")
        .containsEntry("threadName", "thread")
        .containsEntry("stackTrace", "stack_trace");
    assertThat(providers.getElementsByTagName("message").getLength()).isEqualTo(1);
  }

  @Test
  void patternCarriesServiceTraceAndSweepContext() {
    final String pattern =
        providers.getElementsByTagName("pattern").item(0).getTextContent().replaceAll("\\s", "");

    assertThat(pattern)
        .contains("\"service\":\"${APP_NAME}\"")
        .contains("\"trace_id\":\"%X{trace_id:-%X{traceId:-}}\"")
        .contains("\"span_id\":\"%X{span_id:-%X{spanId:-}}\"")
        .contains("\"sweep_id\":\"%X{sweep_id:-}\"")
        .contains("\"reminder_domain\":\"%X{reminder_domain:-}\"");
  }
}
