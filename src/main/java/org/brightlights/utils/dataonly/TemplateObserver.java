package org.brightlights.utils.dataonly;

/**
 * Интерфейс наблюдателя, который получает каждый принятый шаблон.
 * @see TemplateSubject
 */
public interface TemplateObserver {

    /**
     * Единственный метод обновления: в параметре приходит шаблон,
     * прошедший фильтр когерентности.
     * @param accepted принятый шаблон
     */
    void update(AcceptedTemplate accepted);
}
