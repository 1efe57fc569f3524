package com.monitoring.platform;

import com.monitoring.platform.anomaly.AnomalyRule;
import com.monitoring.platform.anomaly.ErrorRateAnomalyRule;
import com.monitoring.platform.datasource.WindowedDataSource;
import com.monitoring.platform.messaging.KafkaCycleSummaryPublisher;
import com.monitoring.platform.notification.ChannelType;
import com.monitoring.platform.notification.NotificationDispatcher;
import com.monitoring.platform.orchestrator.CycleScheduler;
import com.monitoring.platform.orchestrator.MonitoringCycleOrchestrator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Loads the full application context without MySQL: the collector tables are replaced by a mock
 * {@link WindowedDataSource} and the scheduled loop is switched off.
 */
@SpringBootTest(classes = MonitoringPlatformApplication.class)
@TestPropertySource(properties = {
		"spring.autoconfigure.exclude=org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration",
		"monitoring.processing.continuous.enabled=false"
})
class MonitoringPlatformApplicationTests {

	@MockitoBean
	private WindowedDataSource windowedDataSource;

	@Autowired
	private ApplicationContext context;

	@Autowired
	private NotificationDispatcher dispatcher;

	@Test
	void contextLoadsWithDefaultRuleAndAllChannels() {
		assertThat(context.getBean(AnomalyRule.class)).isInstanceOf(ErrorRateAnomalyRule.class);
		assertThat(context.getBean(MonitoringCycleOrchestrator.class)).isNotNull();
		assertThat(context.containsBean("notificationRestTemplate")).isTrue();
		assertThat(context.containsBean("notificationExecutor")).isTrue();
		assertThat(dispatcher.getChannels())
				.containsOnlyKeys(ChannelType.EMAIL, ChannelType.SLACK, ChannelType.WEBHOOK, ChannelType.SMS);
	}

	@Test
	void optionalComponentsStayOffByDefault() {
		assertThat(context.getBeansOfType(CycleScheduler.class)).isEmpty();
		assertThat(context.getBeansOfType(KafkaCycleSummaryPublisher.class)).isEmpty();
	}
}
