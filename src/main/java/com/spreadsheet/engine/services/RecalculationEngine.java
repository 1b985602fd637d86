package com.spreadsheet.engine.services;

import com.spreadsheet.engine.exceptions.CircularReferenceException;
import com.spreadsheet.engine.formula.FormulaEvaluator;
import com.spreadsheet.engine.formula.FormulaParser;
import com.spreadsheet.engine.formula.ParsedFormula;
import com.spreadsheet.engine.graph.DependencyGraph;
import com.spreadsheet.engine.models.Address;
import com.spreadsheet.engine.models.Cell;
import com.spreadsheet.engine.models.CellValue;
import com.spreadsheet.engine.models.RecalculationResult;
import com.spreadsheet.engine.models.Sheet;
import com.spreadsheet.engine.models.SheetState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * The commit protocol: the only code that writes cell contents and graph edges.
 * validate -> cycle check -> apply edges -> affected set -> layered order -> evaluate.
 * Callers hold the sheet's write lock.
 */
class RecalculationEngine {

    private static final Logger logger = LoggerFactory.getLogger(RecalculationEngine.class);

    private final Sheet sheet;
    private final FormulaParser parser;
    private final FormulaEvaluator evaluator;

    RecalculationEngine(Sheet sheet, FormulaEvaluator evaluator) {
        this.sheet = sheet;
        this.parser = new FormulaParser(sheet.getRows(), sheet.getColumns());
        this.evaluator = evaluator;
    }

    FormulaParser getParser() {
        return parser;
    }

    /**
     * Sets a cell's text with these steps:
     * 1) Bounds-check the target and parse the text (rejects before any change).
     * 2) Reject if the new references would close a cycle; nothing is changed.
     * 3) Replace the target's edges and store its text.
     * 4) Recompute the target and everything that transitively reads it, layer by layer.
     */
    RecalculationResult commit(Address target, String text) {
        sheet.checkBounds(target);
        String raw = text == null ? "" : text;
        ParsedFormula parsed = parser.parse(raw);

        DependencyGraph graph = sheet.getGraph();
        if (graph.wouldCycle(target, parsed.getReferences())) {
            throw new CircularReferenceException("Cycle detected: " + target + " = " + raw);
        }

        graph.commitEdges(target, parsed.getReferences());
        sheet.getCell(target).setContent(raw, parsed);

        Set<Address> affected = graph.affectedSet(target);
        List<List<Address>> layers = recalculate(affected);
        logger.debug("Committed {} = '{}': {} cell(s) in {} layer(s)", target, raw, affected.size(), layers.size());
        return new RecalculationResult(target, layers);
    }

    /**
     * Replaces the whole grid after a structural edit. Only positions whose text differs from
     * the current one are reinstalled; once every new text and edge is in place, the changed
     * positions and everything that reads them are evaluated in a single layered pass.
     * The texts are parsed before anything is written, so a text that fails to parse changes nothing.
     */
    List<List<Address>> replaceTexts(String[][] texts) {
        Map<Address, ParsedFormula> changed = new TreeMap<>();
        for (int r = 0; r < sheet.getRows(); r++) {
            for (int c = 0; c < sheet.getColumns(); c++) {
                String text = texts[r][c] == null ? "" : texts[r][c];
                if (!text.equals(sheet.getCell(r, c).getText())) {
                    changed.put(new Address(r, c), parser.parse(text));
                }
            }
        }
        if (changed.isEmpty()) {
            return new ArrayList<>();
        }

        DependencyGraph graph = sheet.getGraph();
        for (Address address : changed.keySet()) {
            graph.clearDependencies(address);
        }
        for (Map.Entry<Address, ParsedFormula> e : changed.entrySet()) {
            Cell cell = sheet.getCell(e.getKey());
            ParsedFormula parsed = e.getValue();
            if (parsed.isBlank()) {
                cell.reset();
            } else {
                graph.commitEdges(e.getKey(), parsed.getReferences());
                cell.setContent(texts[e.getKey().getRow()][e.getKey().getColumn()], parsed);
            }
        }

        Set<Address> affected = new TreeSet<>();
        for (Address address : changed.keySet()) {
            affected.addAll(graph.affectedSet(address));
        }
        List<List<Address>> layers = recalculate(affected);
        logger.debug("Replaced {} cell(s): {} cell(s) re-evaluated in {} layer(s)",
                changed.size(), affected.size(), layers.size());
        return layers;
    }

    /**
     * Restores a snapshot verbatim: texts and values are copied back and edges are derived
     * from the texts. Nothing is re-evaluated.
     * Every text is parsed and the full edge set is checked for cycles before the sheet is
     * touched; a rejected snapshot leaves the current contents in place.
     */
    void load(SheetState state) {
        ParsedFormula[][] parsed = new ParsedFormula[sheet.getRows()][sheet.getColumns()];
        DependencyGraph staged = new DependencyGraph();
        for (int r = 0; r < sheet.getRows(); r++) {
            for (int c = 0; c < sheet.getColumns(); c++) {
                String text = state.getText(r, c);
                if (text == null || text.trim().isEmpty()) {
                    continue;
                }
                Address address = new Address(r, c);
                ParsedFormula formula = parser.parse(text);
                // the edge that closes a cycle is always rejected when it is staged
                if (staged.wouldCycle(address, formula.getReferences())) {
                    throw new CircularReferenceException("Cycle detected in snapshot: " + address + " = " + text);
                }
                staged.commitEdges(address, formula.getReferences());
                parsed[r][c] = formula;
            }
        }

        sheet.clear();
        DependencyGraph graph = sheet.getGraph();
        for (int r = 0; r < sheet.getRows(); r++) {
            for (int c = 0; c < sheet.getColumns(); c++) {
                if (parsed[r][c] == null) {
                    continue;
                }
                Address address = new Address(r, c);
                graph.commitEdges(address, parsed[r][c].getReferences());
                Cell cell = sheet.getCell(address);
                cell.setContent(state.getText(r, c), parsed[r][c]);
                cell.setValue(state.getValue(r, c));
            }
        }
    }

    /**
     * Evaluates {@code affected} in dependency order. Each round takes every remaining cell with
     * no unevaluated dependency inside the set and evaluates that layer in ascending address order.
     */
    List<List<Address>> recalculate(Set<Address> affected) {
        DependencyGraph graph = sheet.getGraph();
        Map<Address, Integer> inDegree = new HashMap<>();
        for (Address cell : affected) {
            inDegree.putIfAbsent(cell, 0);
            for (Address reader : graph.dependentsOf(cell)) {
                if (affected.contains(reader)) {
                    inDegree.merge(reader, 1, Integer::sum);
                }
            }
        }

        List<List<Address>> layers = new ArrayList<>();
        Set<Address> layer = new TreeSet<>();
        for (Map.Entry<Address, Integer> e : inDegree.entrySet()) {
            if (e.getValue() == 0) {
                layer.add(e.getKey());
            }
        }
        int evaluated = 0;
        while (!layer.isEmpty()) {
            for (Address cell : layer) {
                evaluate(sheet.getCell(cell));
            }
            evaluated += layer.size();
            layers.add(new ArrayList<>(layer));

            Set<Address> next = new TreeSet<>();
            for (Address cell : layer) {
                for (Address reader : graph.dependentsOf(cell)) {
                    Integer degree = inDegree.get(reader);
                    if (degree == null) {
                        continue;
                    }
                    inDegree.put(reader, degree - 1);
                    if (degree - 1 == 0) {
                        next.add(reader);
                    }
                }
            }
            layer = next;
        }

        if (evaluated != affected.size()) {
            logger.error("Layered ordering left {} of {} cells unevaluated", affected.size() - evaluated, affected.size());
            throw new IllegalStateException("Dependency graph contains a cycle among " + affected);
        }
        return layers;
    }

    private void evaluate(Cell cell) {
        if (cell.getFormula() == null) {
            cell.setValue(CellValue.ZERO);
            return;
        }
        cell.setValue(evaluator.evaluate(cell.getFormula(), address -> sheet.getCell(address).getValue()));
    }
}
