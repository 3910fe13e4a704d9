package com.codeheadsystems.dynamap.dagger;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import dagger.Module;
import dagger.Provides;
import javax.inject.Singleton;

/**
 * The type Dynamap module.
 */
@Module
public class DynamapModule {

  /**
   * Instantiates a new Dynamap module.
   */
  public DynamapModule() {
    // Default constructor
  }

  /**
   * Object mapper for JSON serialization.
   *
   * @return the object mapper
   */
  @Provides
  @Singleton
  public ObjectMapper objectMapper() {
    return new ObjectMapper().registerModule(new Jdk8Module());
  }
}
