package socialjobs.worker.testing;

import socialjobs.worker.config.WorkerConfig;
import socialjobs.worker.model.JobRecord;
import socialjobs.worker.store.Database;

import java.sql.Connection;
import java.sql.Statement;

/**
 * In-memory H2 databases for tests.
 */
public final class TestDb {

    private TestDb() {
    }

    public static String url(String name) {
        return "jdbc:h2:mem:test-" + name + "-" + System.nanoTime()
                + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    }

    public static Database open(String name) {
        return new Database(WorkerConfig.defaults().withDatabaseUrl(url(name)));
    }

    public static void clear(Database db) throws Exception {
        try (Connection conn = db.getConnection();
                Statement st = conn.createStatement()) {
            st.execute("DELETE FROM social_jobs");
            st.execute("DELETE FROM social_outputs");
            st.execute("DELETE FROM social_vertical_profiles");
            st.execute("DELETE FROM leads");
            st.execute("DELETE FROM audit_log");
            conn.commit();
        }
    }

    public static JobRecord.Builder generateAssetsJob(String id) {
        return JobRecord.builder()
                .id(id)
                .orgId("org-1")
                .activityId("act-" + id)
                .jobType("generate_assets")
                .payload("{\"vertical_key\":\"general\",\"topic\":\"spring promo\"}");
    }
}
