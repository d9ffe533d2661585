package com.banking.scd.core.exception;

import com.banking.scd.core.model.DimensionId;

import java.util.List;

/**
 * More than one version of a natural key is flagged current.
 */
public class AmbiguousCurrentVersionException extends DimensionIntegrityException {

    private final List<Long> surrogateKeys;

    public AmbiguousCurrentVersionException(DimensionId dimension, String naturalKey, List<Long> surrogateKeys) {
        super(dimension, naturalKey, "Natural key " + dimension + "/" + naturalKey
                + " has " + surrogateKeys.size() + " current versions: " + surrogateKeys);
        this.surrogateKeys = List.copyOf(surrogateKeys);
    }

    public List<Long> getSurrogateKeys() {
        return surrogateKeys;
    }
}
