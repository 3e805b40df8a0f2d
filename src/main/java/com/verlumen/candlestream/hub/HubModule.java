package com.verlumen.candlestream.hub;

import com.google.auto.value.AutoValue;
import com.google.inject.AbstractModule;
import com.google.inject.Singleton;
import com.google.inject.assistedinject.FactoryModuleBuilder;

@AutoValue
public abstract class HubModule extends AbstractModule {
  public static HubModule create(ChannelSettings channelSettings) {
    return new AutoValue_HubModule(channelSettings);
  }

  abstract ChannelSettings channelSettings();

  @Override
  protected void configure() {
    bind(ChannelSettings.class).toInstance(channelSettings());
    bind(FanOutHub.class).to(FanOutHubImpl.class).in(Singleton.class);
    install(new FactoryModuleBuilder().build(SubscriberChannel.Factory.class));
  }
}
