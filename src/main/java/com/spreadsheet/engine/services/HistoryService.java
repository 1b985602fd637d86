package com.spreadsheet.engine.services;

import com.spreadsheet.engine.config.SheetProperties;
import com.spreadsheet.engine.models.SheetState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Undo/redo over whole-sheet snapshots.
 * Callers take a {@link #checkpoint()} before an edit they want to be able to undo.
 */
@Service
public class HistoryService {

    private static final Logger logger = LoggerFactory.getLogger(HistoryService.class);

    private final SheetService sheetService;
    private final int capacity;
    private final Deque<SheetState> undoStack = new ArrayDeque<>();
    private final Deque<SheetState> redoStack = new ArrayDeque<>();

    @Autowired
    public HistoryService(SheetService sheetService, SheetProperties properties) {
        this(sheetService, properties.getHistorySize());
    }

    public HistoryService(SheetService sheetService, int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("History size must be at least 1, got " + capacity);
        }
        this.sheetService = sheetService;
        this.capacity = capacity;
    }

    /**
     * Saves the current sheet as an undo point and forgets anything that could be redone.
     * The oldest point is dropped once the history is full.
     */
    public synchronized void checkpoint() {
        push(undoStack, sheetService.snapshot());
        redoStack.clear();
        logger.debug("Checkpoint taken ({} undo point(s))", undoStack.size());
    }

    /**
     * Returns the sheet to the last checkpoint.
     *
     * @return false if there is nothing to undo
     */
    public synchronized boolean undo() {
        if (undoStack.isEmpty()) {
            logger.info("Nothing to undo");
            return false;
        }
        push(redoStack, sheetService.snapshot());
        sheetService.restore(undoStack.pop());
        logger.info("Undo applied ({} undo point(s) left)", undoStack.size());
        return true;
    }

    /**
     * Re-applies the state the last undo moved away from.
     *
     * @return false if there is nothing to redo
     */
    public synchronized boolean redo() {
        if (redoStack.isEmpty()) {
            logger.info("Nothing to redo");
            return false;
        }
        push(undoStack, sheetService.snapshot());
        sheetService.restore(redoStack.pop());
        logger.info("Redo applied ({} redo point(s) left)", redoStack.size());
        return true;
    }

    public synchronized boolean canUndo() {
        return !undoStack.isEmpty();
    }

    public synchronized boolean canRedo() {
        return !redoStack.isEmpty();
    }

    private void push(Deque<SheetState> stack, SheetState state) {
        stack.push(state);
        while (stack.size() > capacity) {
            stack.removeLast();
        }
    }
}
