package com.sunny.trigger.store.handler;

import com.sunny.trigger.core.enums.ScheduleRunStatus;
import org.apache.ibatis.type.BaseTypeHandler;
import org.apache.ibatis.type.JdbcType;
import org.apache.ibatis.type.MappedJdbcTypes;
import org.apache.ibatis.type.MappedTypes;

import java.sql.CallableStatement;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * ScheduleRunStatus 枚举类型处理器
 * <p>
 * 调度运行结果以小写 code 存储为 varchar
 *
 * @author SunnyX6
 * @date 2025-12-14
 */
@MappedTypes(ScheduleRunStatus.class)
@MappedJdbcTypes(JdbcType.VARCHAR)
public class ScheduleRunStatusTypeHandler extends BaseTypeHandler<ScheduleRunStatus> {

    @Override
    public void setNonNullParameter(PreparedStatement ps, int i, ScheduleRunStatus parameter, JdbcType jdbcType) throws SQLException {
        ps.setString(i, parameter.getCode());
    }

    @Override
    public ScheduleRunStatus getNullableResult(ResultSet rs, String columnName) throws SQLException {
        String code = rs.getString(columnName);
        return code == null ? null : ScheduleRunStatus.of(code);
    }

    @Override
    public ScheduleRunStatus getNullableResult(ResultSet rs, int columnIndex) throws SQLException {
        String code = rs.getString(columnIndex);
        return code == null ? null : ScheduleRunStatus.of(code);
    }

    @Override
    public ScheduleRunStatus getNullableResult(CallableStatement cs, int columnIndex) throws SQLException {
        String code = cs.getString(columnIndex);
        return code == null ? null : ScheduleRunStatus.of(code);
    }
}
