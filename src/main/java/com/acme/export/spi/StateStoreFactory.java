package com.acme.export.spi;

import com.acme.export.core.OwnerContext;

public interface StateStoreFactory {
    StateStore open(OwnerContext owner);
}
