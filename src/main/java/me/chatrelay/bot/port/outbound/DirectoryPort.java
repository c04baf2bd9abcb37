package me.chatrelay.bot.port.outbound;

import me.chatrelay.bot.domain.model.DirectoryEntry;

import java.util.List;

/**
 * Port for reading the spreadsheet-style professional directory.
 */
public interface DirectoryPort {

    /**
     * Returns all directory rows in sheet order.
     */
    List<DirectoryEntry> findAll();

    /**
     * Checks if the directory source is reachable.
     */
    boolean isAvailable();
}
