package com.github.scxmljani;

/**
 * This class encapsulates all the configuration parameters for the compiler. Use the
 * {@code CompilerConfigurationBuilder} to build it.
 *
 * Notes:<br>
 * 1. maxArraySize is the capacity every array variable is emitted with, unless its declared type
 * carries an explicit size (eg. int32[5]).<br>
 * 2. internalQueueBound caps the number of raised, not yet consumed internal events a location
 * may hold. Exceeding it is reported as a non-terminating macrostep.<br>
 * 3. randomOptions is the number of equally likely values Math.random() is discretised to.<br>
 */
public final class CompilerConfiguration {
  private final int maxArraySize;
  private final int internalQueueBound;
  private final int randomOptions;
  private final ModelType modelType;

  public int getMaxArraySize() {
    return maxArraySize;
  }

  public int getInternalQueueBound() {
    return internalQueueBound;
  }

  public int getRandomOptions() {
    return randomOptions;
  }

  public ModelType getModelType() {
    return modelType;
  }

  public static CompilerConfiguration defaults() {
    try {
      return CompilerConfigurationBuilder.newBuilder().build();
    } catch (CompilerException impossible) {
      throw new IllegalStateException(impossible);
    }
  }

  /**
   * Kind of JANI model to declare in the emitted document.
   */
  public static enum ModelType {
    MDP("mdp"), DTMC("dtmc"), LTS("lts");

    private final String janiName;

    private ModelType(final String janiName) {
      this.janiName = janiName;
    }

    public String getJaniName() {
      return janiName;
    }
  }

  public final static class CompilerConfigurationBuilder {
    private int maxArraySize = 100;
    private int internalQueueBound = 16;
    private int randomOptions = 100;
    private ModelType modelType = ModelType.MDP;

    public static CompilerConfigurationBuilder newBuilder() {
      return new CompilerConfigurationBuilder();
    }

    public CompilerConfigurationBuilder maxArraySize(int maxArraySize) {
      this.maxArraySize = maxArraySize;
      return this;
    }

    public CompilerConfigurationBuilder internalQueueBound(int internalQueueBound) {
      this.internalQueueBound = internalQueueBound;
      return this;
    }

    public CompilerConfigurationBuilder randomOptions(int randomOptions) {
      this.randomOptions = randomOptions;
      return this;
    }

    public CompilerConfigurationBuilder modelType(final ModelType modelType) {
      this.modelType = modelType;
      return this;
    }

    public CompilerConfiguration build() throws CompilerException {
      final CompilerConfiguration config = new CompilerConfiguration(maxArraySize,
          internalQueueBound, randomOptions, modelType);
      config.validate();
      return config;
    }

    private CompilerConfigurationBuilder() {}
  }

  private void validate() throws CompilerException {
    StringBuilder messages = new StringBuilder();
    if (maxArraySize <= 0) {
      messages.append("maxArraySize must be positive. ");
    }
    if (internalQueueBound <= 0) {
      messages.append("internalQueueBound must be positive. ");
    }
    if (randomOptions < 2) {
      messages.append("randomOptions must be at least 2. ");
    }
    if (modelType == null) {
      messages.append("ModelType cannot be null. ");
    }
    if (messages.length() > 0) {
      throw new CompilerException(CompilerException.Code.INVALID_CONFIGURATION,
          messages.toString().trim());
    }
  }

  /**
   * Copy of this configuration with another array capacity, used when a network description
   * overrides it.
   */
  CompilerConfiguration withMaxArraySize(final int maxArraySize) throws CompilerException {
    return CompilerConfigurationBuilder.newBuilder().maxArraySize(maxArraySize)
        .internalQueueBound(internalQueueBound).randomOptions(randomOptions).modelType(modelType)
        .build();
  }

  @Override
  public String toString() {
    return "CompilerConfiguration [maxArraySize=" + maxArraySize + ", internalQueueBound="
        + internalQueueBound + ", randomOptions=" + randomOptions + ", modelType=" + modelType
        + "]";
  }

  private CompilerConfiguration(final int maxArraySize, final int internalQueueBound,
      final int randomOptions, final ModelType modelType) {
    this.maxArraySize = maxArraySize;
    this.internalQueueBound = internalQueueBound;
    this.randomOptions = randomOptions;
    this.modelType = modelType;
  }

}
