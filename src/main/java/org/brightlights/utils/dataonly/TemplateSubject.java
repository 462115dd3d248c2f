package org.brightlights.utils.dataonly;

/**
 * Интерфейс для субъекта, за которым наблюдают получатели шаблонов.
 * <br>Подразумевается, что на {@link org.brightlights.BrightnessApp} подписываются
 * {@link org.brightlights.utils.outing.DetectionJSONFileWriter} и прочие потребители.</br>
 * @see TemplateObserver
 */
public interface TemplateSubject {

    /**
     * Подписать наблюдателя на текущий субъект.
     * @param newObserver новый наблюдатель
     */
    void attach(TemplateObserver newObserver);

    /**
     * Отписка от обновлений субъекта.
     * @param existingObserver текущий наблюдатель
     */
    void detach(TemplateObserver existingObserver);

    /**
     * Оповещение всех наблюдателей о принятом шаблоне.
     */
    void notifyObservers(AcceptedTemplate accepted);
}
