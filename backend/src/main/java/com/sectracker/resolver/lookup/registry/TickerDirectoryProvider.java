package com.sectracker.resolver.lookup.registry;

import com.sectracker.resolver.lookup.model.RegistryEntry;

import java.util.List;

/**
 * Bulk source of every tradable ticker. Implementations throw
 * {@link com.sectracker.resolver.lookup.ProviderUnavailableException} when the listing cannot be read.
 */
public interface TickerDirectoryProvider {
    List<RegistryEntry> loadEntries();
}
