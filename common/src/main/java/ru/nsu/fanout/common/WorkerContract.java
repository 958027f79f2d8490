package ru.nsu.fanout.common;

/**
 * Пути и имена полей, общие для координатора и worker-ов.
 */
public final class WorkerContract {
    public static final String STATUS_PATH = "/check_status";
    public static final String TASK_PATH = "/get_task";
    public static final String REGISTER_PATH = "/register";
    public static final String SUBMIT_PATH = "/assign_task";
    public static final String WORKERS_PATH = "/workers";

    public static final String TASK_TYPE_FIELD = "task_type";
    public static final String RESULTS_FIELD = "results";
    public static final String FILENAME_FIELD = "filename";

    public static final String DEFAULT_TASK_TYPE = "image";

    private WorkerContract() {
    }
}
