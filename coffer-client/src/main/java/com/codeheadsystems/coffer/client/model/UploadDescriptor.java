package com.codeheadsystems.coffer.client.model;

import com.codeheadsystems.coffer.model.upload.ObjectExpiration;
import com.codeheadsystems.coffer.model.upload.ResolutionStrategy;
import java.time.Instant;
import java.util.Objects;

/**
 * What is uploaded and how the server should store it.
 * <p>
 * {@code size} must be the exact number of bytes the source yields; encrypted uploads allocate
 * buffers of that size.
 *
 * @param name                  the file name
 * @param size                  the size in bytes
 * @param timestampCreation     optional creation time
 * @param timestampModification optional modification time
 * @param classification        optional classification level
 * @param expiration            optional expiration policy
 * @param resolutionStrategy    name collision policy
 * @param keepShareLinks        keep share links when overwriting
 */
public record UploadDescriptor(String name,
                               long size,
                               Instant timestampCreation,
                               Instant timestampModification,
                               Integer classification,
                               ObjectExpiration expiration,
                               ResolutionStrategy resolutionStrategy,
                               boolean keepShareLinks) {

  public UploadDescriptor {
    Objects.requireNonNull(name, "name");
    if (size < 0) {
      throw new IllegalArgumentException("size must not be negative: " + size);
    }
    if (resolutionStrategy == null) {
      resolutionStrategy = ResolutionStrategy.AUTO_RENAME;
    }
  }

  public static Builder builder(final String name, final long size) {
    return new Builder(name, size);
  }

  public static UploadDescriptor of(final String name, final long size) {
    return builder(name, size).build();
  }

  /**
   * The type Builder.
   */
  public static class Builder {
    private final String name;
    private final long size;
    private Instant timestampCreation;
    private Instant timestampModification;
    private Integer classification;
    private ObjectExpiration expiration;
    private ResolutionStrategy resolutionStrategy = ResolutionStrategy.AUTO_RENAME;
    private boolean keepShareLinks;

    private Builder(final String name, final long size) {
      this.name = name;
      this.size = size;
    }

    public Builder timestampCreation(final Instant value) {
      this.timestampCreation = value;
      return this;
    }

    public Builder timestampModification(final Instant value) {
      this.timestampModification = value;
      return this;
    }

    public Builder classification(final int value) {
      this.classification = value;
      return this;
    }

    public Builder expiration(final ObjectExpiration value) {
      this.expiration = value;
      return this;
    }

    public Builder resolutionStrategy(final ResolutionStrategy value) {
      this.resolutionStrategy = value;
      return this;
    }

    public Builder keepShareLinks(final boolean value) {
      this.keepShareLinks = value;
      return this;
    }

    public UploadDescriptor build() {
      return new UploadDescriptor(name, size, timestampCreation, timestampModification, classification,
          expiration, resolutionStrategy, keepShareLinks);
    }
  }
}
