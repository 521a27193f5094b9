package org.calista.metatot.plan.engine;

/**
 * SearchEngine — внутренний контракт одного прогона поиска по дереву.
 *
 * <p>ВАЖНО:
 * <ul>
 *   <li>НЕ orchestrator (решение gate, трассы и события выше, в MetaToT)</li>
 *   <li>НЕ владеет пулом потоков</li>
 *   <li>дерево создаётся на каждый прогон и не разделяется между сессиями</li>
 * </ul>
 */
public interface SearchEngine {

    /**
     * Runs select/expand/evaluate/backup until the budget, the deadline or the
     * cancellation token stops it, then extracts the best path.
     */
    SearchOutcome search(SearchTask task);
}
