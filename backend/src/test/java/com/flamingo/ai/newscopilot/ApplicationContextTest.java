package com.flamingo.ai.newscopilot;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.newscopilot.agent.AgentRegistry;
import com.flamingo.ai.newscopilot.domain.enums.AnalysisKind;
import com.flamingo.ai.newscopilot.service.cache.AnalysisResultCache;
import com.flamingo.ai.newscopilot.service.coordinator.AnalysisCoordinator;
import com.flamingo.ai.newscopilot.service.coordinator.AnalysisStreamService;
import com.flamingo.ai.newscopilot.service.llm.LlmClient;
import dev.langchain4j.model.chat.ChatModel;
import java.util.EnumSet;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

/** Verifies the application context loads with the LLM provider mocked out. */
@SpringBootTest
class ApplicationContextTest {

  @MockitoBean private ChatModel chatModel;

  @Autowired private ApplicationContext applicationContext;

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext).isNotNull();
  }

  @Test
  @DisplayName("Coordination beans should be available")
  void coordinationBeansShouldBeAvailable() {
    assertThat(applicationContext.getBean(AnalysisCoordinator.class)).isNotNull();
    assertThat(applicationContext.getBean(AnalysisStreamService.class)).isNotNull();
    assertThat(applicationContext.getBean(AnalysisResultCache.class)).isNotNull();
    assertThat(applicationContext.getBean(LlmClient.class)).isNotNull();
  }

  @Test
  @DisplayName("Every analysis kind should have a registered agent")
  void everyKindShouldHaveAnAgent() {
    AgentRegistry registry = applicationContext.getBean(AgentRegistry.class);
    assertThat(registry.registeredKinds()).isEqualTo(EnumSet.allOf(AnalysisKind.class));
  }
}
