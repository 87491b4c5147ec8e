package com.pharmasop.types.common;

/**
 * 全局常量定义类。
 *
 * @author pharmasop
 * @since 2026-10-01
 */
public class Constants {

    /** 逗号分隔符，用于字符串分割操作 */
    public final static String SPLIT = ",";

    /** 审计记录中 SOP 作业的资源类型 */
    public final static String RESOURCE_TYPE_SOP_JOB = "sop_job";

    /** 审计记录中审计条目自身的资源类型 */
    public final static String RESOURCE_TYPE_AUDIT_ENTRY = "audit_entry";

    /** 系统内部触发的动作使用的操作者标识 */
    public final static String SYSTEM_ACTOR = "system";

    /** 缺失章节占位正文模板，%s 为章节标题 */
    public final static String PLACEHOLDER_BODY_TEMPLATE = "[Generated content for %s section - please review and complete]";

}
