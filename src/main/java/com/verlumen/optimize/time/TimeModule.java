package com.verlumen.optimize.time;

import com.google.inject.AbstractModule;

public final class TimeModule extends AbstractModule {
  public static TimeModule create() {
    return new TimeModule();
  }

  private TimeModule() {}

  @Override
  protected void configure() {
    bind(TimeRangeParser.class).to(TimeRangeParserImpl.class);
  }
}
