package org.newslens.client;

import org.junit.jupiter.api.Test;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

class NewsDatabaseClientTest {

    @Test
    void rendersHeaderAndRows() throws Exception {
        ResultSet rs = mock(ResultSet.class);
        ResultSetMetaData meta = mock(ResultSetMetaData.class);
        when(rs.getMetaData()).thenReturn(meta);
        when(meta.getColumnCount()).thenReturn(2);
        when(meta.getColumnLabel(1)).thenReturn("category");
        when(meta.getColumnLabel(2)).thenReturn("count");
        when(rs.next()).thenReturn(true, true, false);
        when(rs.getObject(1)).thenReturn("sport", "politics");
        when(rs.getObject(2)).thenReturn(12L, null);

        String text = NewsDatabaseClient.renderRows(rs);

        assertThat(text).isEqualTo("category | count\nsport | 12\npolitics | NULL");
    }

    @Test
    void noRowsRenderEmpty() throws Exception {
        ResultSet rs = mock(ResultSet.class);
        ResultSetMetaData meta = mock(ResultSetMetaData.class);
        when(rs.getMetaData()).thenReturn(meta);
        when(meta.getColumnCount()).thenReturn(3);
        when(rs.next()).thenReturn(false);

        assertThat(NewsDatabaseClient.renderRows(rs)).isEmpty();
    }
}
