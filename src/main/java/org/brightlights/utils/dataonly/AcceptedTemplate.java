package org.brightlights.utils.dataonly;

/**
 * Шаблон, прошедший фильтр когерентности.
 * @param window окно шаблона
 * @param coherence оценка когерентности
 */
public record AcceptedTemplate(TemplateWindow window, double coherence) {

    public GridNode node() { return window.node(); }
}
