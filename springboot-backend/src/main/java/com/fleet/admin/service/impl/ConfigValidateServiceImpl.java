package com.fleet.admin.service.impl;

import cn.hutool.core.io.FileUtil;
import com.alibaba.fastjson.JSON;
import com.alibaba.fastjson.JSONObject;
import com.fleet.admin.common.config.FleetProperties;
import com.fleet.admin.common.exception.ConfigValidationException;
import com.fleet.admin.service.ConfigValidateService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.annotation.Resource;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.concurrent.TimeUnit;

@Slf4j
@Service
public class ConfigValidateServiceImpl implements ConfigValidateService {

    @Resource
    private FleetProperties fleetProperties;

    @Override
    public void validate(JSONObject document) {
        FleetProperties.SingBox props = fleetProperties.getSingbox();
        File configFile = null;
        File outputFile = null;
        try {
            configFile = Files.createTempFile("singbox_check_", ".json").toFile();
            outputFile = Files.createTempFile("singbox_check_", ".log").toFile();
            FileUtil.writeUtf8String(JSON.toJSONString(document, true), configFile);

            ProcessBuilder builder = new ProcessBuilder(props.getBinary(), "check", "-c", configFile.getAbsolutePath())
                    .redirectErrorStream(true)
                    .redirectOutput(outputFile);
            Process process;
            try {
                process = builder.start();
            } catch (IOException e) {
                log.warn("无法执行 {}，跳过配置校验: {}", props.getBinary(), e.getMessage());
                return;
            }

            if (!process.waitFor(props.getCheckTimeoutSeconds(), TimeUnit.SECONDS)) {
                process.destroyForcibly();
                throw new ConfigValidationException("sing-box 配置校验超时（" + props.getCheckTimeoutSeconds() + " 秒）");
            }
            if (process.exitValue() != 0) {
                String output = FileUtil.readUtf8String(outputFile).trim();
                throw new ConfigValidationException("sing-box 配置校验失败: " + output);
            }
        } catch (IOException e) {
            throw new ConfigValidationException("写入临时配置文件失败: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConfigValidationException("sing-box 配置校验被中断", e);
        } finally {
            FileUtil.del(configFile);
            FileUtil.del(outputFile);
        }
    }
}
