package de.bsommerfeld.repoindex.core.model;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * App ids the repository asks clients to install or uninstall.
 */
public record Requests(List<String> install, List<String> uninstall) {

    public static final Requests NONE = new Requests(List.of(), List.of());

    public Requests {
        install = install == null ? List.of() : ImmutableList.copyOf(install);
        uninstall = uninstall == null ? List.of() : ImmutableList.copyOf(uninstall);
    }
}
