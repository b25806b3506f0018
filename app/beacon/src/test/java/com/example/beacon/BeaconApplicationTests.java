package com.example.beacon;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.beacon.channel.ChannelAdapterRegistry;
import com.example.beacon.channel.LocalChannelAdapter;
import com.example.beacon.dispatch.DeliveryWorker;
import com.example.beacon.model.Channel;
import com.example.beacon.nats.HazardReportSubscriber;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class BeaconApplicationTests extends AbstractPostgresContainerTest {

  @Autowired private ApplicationContext context;
  @Autowired private ChannelAdapterRegistry channelAdapterRegistry;

  @Test
  void contextLoadsWithLocalChannelsAndWorkersDisabled() {
    assertThat(channelAdapterRegistry.adapter(Channel.EMAIL))
        .isInstanceOf(LocalChannelAdapter.class);
    assertThat(channelAdapterRegistry.adapter(Channel.SMS)).isInstanceOf(LocalChannelAdapter.class);
    assertThat(context.getBeanNamesForType(DeliveryWorker.class)).isEmpty();
    assertThat(context.getBeanNamesForType(HazardReportSubscriber.class)).isEmpty();
  }
}
